package io.routeflow.serialization.rule;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.GraphMetadata;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.Position;
import io.routeflow.core.graph.node.StartNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Builds the graph for one rule document.
///
/// Node ids share one counter per document across every kind, so the ids of an endpoint rule
/// are `start_1`, `function_2`, `end_3`. Layout is a single column at `x = 200` with
/// true-branch ends placed to the right.
///
/// @implNote Package-private. Use {@link RuleDocumentConverter}.
final class RuleGraphImporter {

    private static final double COLUMN_X = 200;
    private static final double FIRST_ROW_Y = 200;
    private static final double START_Y = 50;
    private static final double DECISION_TRUE_X = 400;
    private static final double DECISION_ROW_STEP = 150;
    private static final double CHAIN_TRUE_X = 450;
    private static final double CHAIN_ROW_STEP = 180;

    private final JsonNode document;
    private final FlowGraph.Builder graph = FlowGraph.builder();
    private int counter = 1;

    private RuleGraphImporter(JsonNode document) {
        this.document = document;
    }

    /// Converts a document of a known shape.
    ///
    /// @param document one rule object, not null
    /// @param name flow name for the graph metadata
    /// @return graph carrying the compact document text as its source document
    /// @throws UnsupportedRuleFormatException if the shape is unknown or required fields are
    /// missing
    static FlowGraph importDocument(JsonNode document, String name) {
        RuleGraphImporter importer = new RuleGraphImporter(document);
        switch (RuleShape.detect(document)) {
            case ENDPOINT -> importer.endpoint();
            case DECISION -> importer.decision();
            case EVALUATION_CHAIN -> importer.evaluationChain();
        }
        return importer.graph.metadata(new GraphMetadata(name, document.toString())).build();
    }

    private void endpoint() {
        JsonNode details = document.get("details");
        if (details == null || !details.isObject()) {
            throw new UnsupportedRuleFormatException(
                    "Endpoint rule '" + document.path("id").asText() + "' has no details");
        }
        String startId = start(text(document, "id"));
        EndpointDetails endpoint =
                new EndpointDetails(
                        details.path("queueName").asText(), details.path("isDefault").asBoolean());
        String functionId = nextId("function");
        graph.node(
                FunctionNode.builder()
                        .id(functionId)
                        .label(text(document, "label"))
                        .position(new Position(COLUMN_X, FIRST_ROW_Y))
                        .body(endpoint.toFunctionBody())
                        .build());
        String endId = nextId("end");
        graph.node(
                EndNode.builder()
                        .id(endId)
                        .label("End")
                        .position(new Position(COLUMN_X, 350))
                        .build());
        graph.edge(startId, functionId);
        graph.edge(functionId, endId);
    }

    private void decision() {
        String startId = start(text(document, "id"));
        String label = text(document, "label");
        String previous = startId;
        double y = FIRST_ROW_Y;
        int index = 0;
        for (JsonNode expression : document.path("details").path("expressions")) {
            index++;
            String conditionId = nextId("condition");
            graph.node(
                    ConditionNode.builder()
                            .id(conditionId)
                            .label(label)
                            .position(new Position(COLUMN_X, y))
                            .expression(expression.asText())
                            .build());
            graph.edge(previous, conditionId, previous.equals(startId) ? null : Branch.FALSE);
            String trueEndId = nextId("end_true");
            graph.node(
                    EndNode.builder()
                            .id(trueEndId)
                            .label("TRUE: Condition " + index)
                            .position(new Position(DECISION_TRUE_X, y))
                            .build());
            graph.edge(conditionId, trueEndId, Branch.TRUE);
            previous = conditionId;
            y += DECISION_ROW_STEP;
        }
        String falseEndId = nextId("end_false");
        graph.node(
                EndNode.builder()
                        .id(falseEndId)
                        .label("FALSE: All conditions failed")
                        .position(new Position(COLUMN_X, y))
                        .build());
        graph.edge(previous, falseEndId, previous.equals(startId) ? null : Branch.FALSE);
    }

    private void evaluationChain() {
        String startId = start(text(document, "Id"));
        String name = document.path("Name").asText("");
        List<JsonNode> evaluations = new ArrayList<>();
        document.path("Evaluations").forEach(evaluations::add);
        evaluations.sort(Comparator.comparingInt(e -> e.path("Order").asInt(0)));

        String previous = startId;
        double y = FIRST_ROW_Y;
        for (JsonNode evaluation : evaluations) {
            String conditionId = nextId("condition");
            String expression = text(evaluation, "Expression");
            graph.node(
                    ConditionNode.builder()
                            .id(conditionId)
                            .label(name + " (" + evaluation.path("Order").asText() + ")")
                            .position(new Position(COLUMN_X, y))
                            .expression(
                                    expression == null || expression.isBlank()
                                            ? "true"
                                            : expression)
                            .build());
            graph.edge(previous, conditionId, previous.equals(startId) ? null : Branch.FALSE);
            String trueEndId = nextId("end_true");
            graph.node(
                    resultEnd(evaluation.path("Result"), "TRUE: ", "Endpoint")
                            .id(trueEndId)
                            .position(new Position(CHAIN_TRUE_X, y))
                            .build());
            graph.edge(conditionId, trueEndId, Branch.TRUE);
            previous = conditionId;
            y += CHAIN_ROW_STEP;
        }
        String defaultEndId = nextId("end_default");
        graph.node(
                resultEnd(document.path("DefaultResult"), "DEFAULT: ", "Default Endpoint")
                        .id(defaultEndId)
                        .position(new Position(COLUMN_X, y))
                        .build());
        graph.edge(previous, defaultEndId, previous.equals(startId) ? null : Branch.FALSE);
    }

    /// End node for an evaluation result: an endpoint queue, or a link to another rule.
    private static EndNode.Builder resultEnd(JsonNode result, String prefix, String fallback) {
        JsonNode value = result.path("ResultValue");
        String linked = text(value.path("Decision"), "Name");
        if (linked != null && !linked.isBlank()) {
            return EndNode.builder().label(prefix + "→ " + linked).linkTarget(linked);
        }
        String queue = text(value.path("EndPoint"), "Qname");
        String queueLabel = queue == null || queue.isBlank() ? fallback : queue;
        return EndNode.builder().label(prefix + queueLabel);
    }

    private String start(String idLabel) {
        String startId = nextId("start");
        graph.node(
                StartNode.builder()
                        .id(startId)
                        .label("Start")
                        .position(new Position(COLUMN_X, START_Y))
                        .idLabel(idLabel)
                        .build());
        return startId;
    }

    private String nextId(String prefix) {
        return prefix + "_" + counter++;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
