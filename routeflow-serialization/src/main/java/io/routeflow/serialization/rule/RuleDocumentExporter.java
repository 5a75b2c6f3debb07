package io.routeflow.serialization.rule;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.List;

/// Re-derives a rule document from an authored graph.
///
/// ### Shape selection
/// - any Condition node: decision shape listing every condition expression in node order
/// - otherwise any Function node: endpoint shape with queue details read from the first
///   Function body
/// - otherwise: endpoint shape routed to {@link EndpointDetails#DEFAULT_QUEUE}
///
/// @implNote Package-private. Imported graphs never reach this class; the converter returns
/// their stored document instead.
final class RuleDocumentExporter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RuleDocumentExporter() {}

    static ObjectNode derive(FlowGraph graph) {
        String name = graph.getMetadata().name();
        String id = RuleIds.fromName(name);
        List<Node> conditions = graph.nodesOfKind(NodeType.CONDITION);
        if (!conditions.isEmpty()) {
            ArrayNode expressions = NODES.arrayNode();
            for (Node node : conditions) {
                String expression = ((ConditionNode) node).getExpression();
                expressions.add(expression == null || expression.isBlank() ? "true" : expression);
            }
            ObjectNode document = header(id, "decision", orDefault(name, "Exported Decision Flow"));
            ObjectNode details = document.putObject("details");
            details.set("expressions", expressions);
            details.put("resultType", "endpoint");
            return document;
        }
        List<Node> functions = graph.nodesOfKind(NodeType.FUNCTION);
        if (!functions.isEmpty()) {
            FunctionNode function = (FunctionNode) functions.get(0);
            return endpoint(
                    id,
                    orDefault(function.getLabel(), orDefault(name, "Exported Function Flow")),
                    EndpointDetails.fromFunctionBody(function.getBody()));
        }
        return endpoint(
                id,
                orDefault(name, "Exported Flow"),
                new EndpointDetails(EndpointDetails.DEFAULT_QUEUE, false));
    }

    private static ObjectNode endpoint(String id, String label, EndpointDetails endpoint) {
        ObjectNode document = header(id, "endpoint", label);
        ObjectNode details = document.putObject("details");
        details.put("queueName", endpoint.queueName());
        details.put("isDefault", endpoint.isDefault());
        return document;
    }

    private static ObjectNode header(String id, String type, String label) {
        ObjectNode document = NODES.objectNode();
        document.put("id", id);
        document.put("type", type);
        document.put("label", label);
        return document;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
