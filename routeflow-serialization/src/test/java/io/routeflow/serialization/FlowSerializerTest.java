package io.routeflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.routeflow.core.RouteflowFactory;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.GraphMetadata;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Position;
import io.routeflow.core.graph.node.StartNode;
import io.routeflow.core.validation.FlowValidator;
import io.routeflow.core.validation.IssueKind;
import io.routeflow.core.validation.ValidationResult;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FlowSerializerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Nested
    class Graphs {

        @Test
        void roundTrip_allNodeKinds() {
            FlowGraph original = ageCheck();

            FlowGraph restored = FlowSerializer.graphFromJson(FlowSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
            assertThat(restored.node("end_6")).get().isInstanceOf(EndNode.class);
            assertThat(((EndNode) restored.node("end_6").orElseThrow()).getLinkTarget())
                    .contains("AdultRouting");
        }

        @Test
        void writesBranchAsSourceHandle() throws Exception {
            JsonNode json = MAPPER.readTree(FlowSerializer.toJson(ageCheck()));

            JsonNode trueEdge = json.get("edges").get(2);
            assertThat(trueEdge.get("id").asText()).isEqualTo("edge_condition_3_end_4");
            assertThat(trueEdge.get("sourceHandle").asText()).isEqualTo("true");
            assertThat(json.get("edges").get(0).has("sourceHandle")).isFalse();
        }

        @Test
        void writesNodePayloadUnderData() throws Exception {
            JsonNode json = MAPPER.readTree(FlowSerializer.toJson(ageCheck()));

            JsonNode input = json.get("nodes").get(1);
            assertThat(input.get("type").asText()).isEqualTo("input");
            assertThat(input.get("position").get("x").asDouble()).isEqualTo(200.0);
            assertThat(input.get("data").get("variable").asText()).isEqualTo("age");
            assertThat(input.get("data").get("value").asText()).isEqualTo("25");
        }

        @Test
        void missingEdgeId_derivedFromEndpoints() {
            String json =
                    """
                    {"nodes": [
                       {"id": "start_1", "type": "start", "data": {"label": "Start"}},
                       {"id": "end_2", "type": "end", "data": {"label": "End"}}],
                     "edges": [{"source": "start_1", "target": "end_2", "sourceHandle": "out"}]}
                    """;

            FlowGraph graph = FlowSerializer.graphFromJson(json);

            assertThat(graph.getEdges())
                    .containsExactly(new Edge("edge_start_1_end_2", "start_1", "end_2", null));
            assertThat(graph.node("start_1").orElseThrow().getPosition()).isNull();
        }

        @Test
        void numericInputValue_keptAsLiteralText() {
            String json =
                    """
                    {"nodes": [{"id": "input_1", "type": "input",
                                "data": {"label": "Age", "variable": "age", "value": 42}}],
                     "edges": []}
                    """;

            InputNode input =
                    (InputNode) FlowSerializer.graphFromJson(json).node("input_1").orElseThrow();

            assertThat(input.getLiteralValue()).isEqualTo("42");
            assertThat(input.parsedValue()).isEqualTo(42.0);
        }

        @Test
        void unknownNodeType_rejected() {
            String json =
                    """
                    {"nodes": [{"id": "x_1", "type": "loop", "data": {}}], "edges": []}
                    """;

            assertThatThrownBy(() -> FlowSerializer.graphFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize graph");
        }

        @Test
        void edgeWithoutTarget_rejected() {
            String json =
                    """
                    {"nodes": [], "edges": [{"id": "e", "source": "start_1"}]}
                    """;

            assertThatThrownBy(() -> FlowSerializer.graphFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'source' and 'target'");
        }

        @Test
        void sourceDocument_embeddedAsJsonAndRestored() throws Exception {
            String rule = "{\"id\":\"R1\",\"type\":\"endpoint\",\"label\":\"Sales\"}";
            FlowGraph graph =
                    ageCheck().withMetadata(new GraphMetadata("Rule1", rule));

            String text = FlowSerializer.toJson(graph);
            JsonNode json = MAPPER.readTree(text);

            assertThat(json.get("name").asText()).isEqualTo("Rule1");
            assertThat(json.get("sourceDocument").isObject()).isTrue();
            assertThat(json.get("sourceDocument").get("label").asText()).isEqualTo("Sales");
            assertThat(FlowSerializer.graphFromJson(text).getMetadata())
                    .isEqualTo(new GraphMetadata("Rule1", rule));
        }
    }

    @Nested
    class SavedFlows {

        @Test
        void roundTrip_withValidation() {
            FlowGraph graph = ageCheck();
            ValidationResult validation = new FlowValidator().validate(graph);
            SavedFlow saved =
                    SavedFlow.of("Age check", graph, validation, Instant.parse("2024-05-01T10:15:30Z"));

            SavedFlow restored = FlowSerializer.savedFlowFromJson(FlowSerializer.toJson(saved));

            assertThat(restored.name()).isEqualTo("Age check");
            assertThat(restored.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
            assertThat(restored.version()).isEqualTo(SavedFlow.CURRENT_VERSION);
            assertThat(restored.graph()).isEqualTo(saved.graph());
            assertThat(restored.validation()).isEqualTo(validation);
        }

        @Test
        void createdAt_writtenAsIsoText() throws Exception {
            SavedFlow saved =
                    SavedFlow.of("Flow", ageCheck(), null, Instant.parse("2024-05-01T10:15:30Z"));

            JsonNode json = MAPPER.readTree(FlowSerializer.toJson(saved));

            assertThat(json.get("createdAt").asText()).isEqualTo("2024-05-01T10:15:30Z");
            assertThat(json.has("validation")).isFalse();
            assertThat(json.get("nodes")).hasSize(6);
        }

        @Test
        void savedFlowFile_readsAsGraph() {
            SavedFlow saved = SavedFlow.of("Flow", ageCheck(), null, Instant.EPOCH);

            FlowGraph graph = FlowSerializer.graphFromJson(FlowSerializer.toJson(saved));

            assertThat(graph.getMetadata().name()).isEqualTo("Flow");
            assertThat(graph.getNodes()).hasSize(6);
        }

        @Test
        void missingName_rejected() {
            assertThatThrownBy(
                            () ->
                                    FlowSerializer.savedFlowFromJson(
                                            "{\"createdAt\":\"2024-01-01T00:00:00Z\",\"nodes\":[]}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'name' is required");
        }
    }

    @Nested
    class Results {

        @Test
        void validationResult_writesCodesAndSummary() throws Exception {
            FlowGraph graph =
                    FlowGraph.builder()
                            .node(StartNode.builder().id("start_1").build())
                            .build();
            ValidationResult result = new FlowValidator().validate(graph);

            JsonNode json = MAPPER.readTree(FlowSerializer.toJson(result));

            assertThat(json.get("isValid").asBoolean()).isFalse();
            assertThat(json.get("errors").findValuesAsText("type"))
                    .contains(IssueKind.MISSING_END.code());
            assertThat(json.get("errors").get(0).get("severity").asText()).isEqualTo("error");
            assertThat(json.get("summary").get("nodeCount").asInt()).isEqualTo(1);
            assertThat(FlowSerializer.validationFromJson(json.toString())).isEqualTo(result);
        }

        @Test
        void trace_writesStepsWithWholeNumbers() throws Exception {
            ExecutionTrace trace =
                    RouteflowFactory.createEnvironment()
                            .getSimulator()
                            .simulate(ageCheck(), Map.of());

            JsonNode json = MAPPER.readTree(FlowSerializer.toJson(trace));
            JsonNode steps = json.get("steps");

            assertThat(steps.get(0).get("code").asText()).isEqualTo("node_visited");
            assertThat(steps.get(0).get("level").asText()).isEqualTo("info");
            assertThat(steps.get(0).get("position").get("y").asDouble()).isEqualTo(50.0);

            JsonNode condition = null;
            for (JsonNode step : steps) {
                if (step.get("code").asText().equals("condition_evaluated")) {
                    condition = step;
                }
            }
            assertThat(condition).isNotNull();
            assertThat(condition.get("variablesSnapshot").get("age").toString()).isEqualTo("25");
            assertThat(condition.get("conditionDetail").get("substitutedExpression").asText())
                    .isEqualTo("25 >= 18");
            assertThat(condition.get("conditionDetail").get("result").asBoolean()).isTrue();
        }
    }

    static FlowGraph ageCheck() {
        return FlowGraph.builder()
                .node(StartNode.builder().id("start_1").position(new Position(200, 50)).build())
                .node(
                        InputNode.builder()
                                .id("input_2")
                                .label("Age")
                                .position(new Position(200, 150))
                                .variableName("age")
                                .literalValue("25")
                                .build())
                .node(
                        ConditionNode.builder()
                                .id("condition_3")
                                .position(new Position(200, 250))
                                .expression("age >= 18")
                                .build())
                .node(
                        FunctionNode.builder()
                                .id("function_5")
                                .position(new Position(400, 250))
                                .body("return { minor: true };")
                                .build())
                .node(
                        EndNode.builder()
                                .id("end_4")
                                .label("Adult")
                                .position(new Position(200, 400))
                                .build())
                .node(
                        EndNode.builder()
                                .id("end_6")
                                .label("Linked")
                                .position(new Position(400, 400))
                                .linkTarget("AdultRouting")
                                .build())
                .edge("start_1", "input_2")
                .edge("input_2", "condition_3")
                .edge("condition_3", "end_4", Branch.TRUE)
                .edge("condition_3", "function_5", Branch.FALSE)
                .edge("function_5", "end_6")
                .build();
    }
}
