package io.routeflow.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import io.routeflow.core.graph.node.StartNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("FlowGraph")
class FlowGraphTest {

    private static FlowGraph sample() {
        return FlowGraph.builder()
                .node(StartNode.builder().id("start_1").build())
                .node(ConditionNode.builder().id("condition_2").expression("x > 1").build())
                .node(EndNode.builder().id("end_3").label("Yes").build())
                .node(EndNode.builder().id("end_4").label("No").build())
                .edge("start_1", "condition_2")
                .edge("condition_2", "end_3", Branch.TRUE)
                .edge("condition_2", "end_4", Branch.FALSE)
                .build();
    }

    @Nested
    class Queries {

        @Test
        void shouldFindNodesById() {
            FlowGraph graph = sample();

            assertThat(graph.node("end_3")).map(Node::getLabel).contains("Yes");
            assertThat(graph.node("missing")).isEmpty();
            assertThat(graph.containsNode("start_1")).isTrue();
        }

        @Test
        void shouldFilterEdgesByBranch() {
            FlowGraph graph = sample();

            assertThat(graph.edgesFrom("condition_2")).hasSize(2);
            assertThat(graph.edgesFrom("condition_2", Branch.TRUE))
                    .extracting(Edge::target)
                    .containsExactly("end_3");
            assertThat(graph.edgesFrom("start_1", Branch.TRUE)).isEmpty();
            assertThat(graph.edgesTo("end_4"))
                    .extracting(Edge::id)
                    .containsExactly("edge_condition_2_end_4");
        }

        @Test
        void shouldReturnFirstStartInAuthoringOrder() {
            FlowGraph graph =
                    sample().withNode(StartNode.builder().id("start_9").label("Second").build());

            assertThat(graph.firstStart()).map(Node::getId).contains("start_1");
            assertThat(graph.nodesOfKind(NodeType.START)).hasSize(2);
        }

        @Test
        void shouldHaveNoStartWhenEmpty() {
            assertThat(FlowGraph.empty().firstStart()).isEmpty();
            assertThat(FlowGraph.empty().getMetadata()).isEqualTo(GraphMetadata.EMPTY);
        }
    }

    @Nested
    class Edits {

        @Test
        void shouldLeaveOriginalUntouched() {
            FlowGraph original = sample();

            FlowGraph edited = original.withoutNode("condition_2");

            assertThat(original.getNodes()).hasSize(4);
            assertThat(original.getEdges()).hasSize(3);
            assertThat(edited.getNodes()).hasSize(3);
            assertThat(edited.getEdges()).isEmpty();
        }

        @Test
        void shouldReplaceNodeWithSameId() {
            FlowGraph graph =
                    sample().withNode(EndNode.builder().id("end_3").label("Accepted").build());

            assertThat(graph.getNodes()).hasSize(4);
            assertThat(graph.getNodes().get(2).getLabel()).isEqualTo("Accepted");
        }

        @Test
        void shouldGenerateDistinctEdgeIdsOnConnect() {
            FlowGraph graph = sample().connect("start_1", "condition_2", null);

            assertThat(graph.getEdges())
                    .extracting(Edge::id)
                    .contains("edge_start_1_condition_2", "edge_start_1_condition_2_2");
        }

        @Test
        void shouldRemoveEdgeById() {
            FlowGraph graph = sample().withoutEdge("edge_condition_2_end_4");

            assertThat(graph.edgesFrom("condition_2", Branch.FALSE)).isEmpty();
        }

        @Test
        void shouldKeepMetadataAcrossEdits() {
            FlowGraph graph =
                    sample().withMetadata(new GraphMetadata("Routing", "{}")).withoutNode("end_4");

            assertThat(graph.getMetadata().name()).isEqualTo("Routing");
            assertThat(graph.getMetadata().isImported()).isTrue();
        }
    }

    @Nested
    class Identifiers {

        @Test
        void shouldContinueAfterHighestSuffix() {
            assertThat(sample().nextNodeId(NodeType.INPUT)).isEqualTo("input_5");
        }

        @Test
        void shouldContinueAfterTimestampSuffix() {
            FlowGraph graph =
                    FlowGraph.builder()
                            .node(
                                    ConditionNode.builder()
                                            .id("condition_1712345678901")
                                            .expression("true")
                                            .build())
                            .build();

            assertThat(graph.nextNodeId(NodeType.END)).isEqualTo("end_1712345678902");
        }

        @Test
        void shouldStartAtOneForEmptyGraph() {
            assertThat(FlowGraph.empty().nextNodeId(NodeType.START)).isEqualTo("start_1");
        }
    }

    @Nested
    class Nodes {

        @Test
        void shouldDefaultLabelToKindName() {
            assertThat(StartNode.builder().id("s").build().getLabel()).isEqualTo("Start");
            assertThat(ConditionNode.builder().id("c").expression("true").build().getLabel())
                    .isEqualTo("Condition");
        }

        @Test
        void shouldRequireConditionExpression() {
            assertThatThrownBy(() -> ConditionNode.builder().id("c").build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("expression");
        }

        @Test
        void shouldRequireInputVariable() {
            assertThatThrownBy(() -> InputNode.builder().id("i").literalValue("1").build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @ParameterizedTest
        @CsvSource({"25, 25.0", "-3.5, -3.5", "1e3, 1000.0"})
        void shouldParseNumericLiterals(String text, double expected) {
            assertThat(InputNode.parseLiteral(text)).isEqualTo(expected);
        }

        @Test
        void shouldKeepTextLiterals() {
            assertThat(InputNode.parseLiteral("gold")).isEqualTo("gold");
            assertThat(InputNode.parseLiteral(null)).isEqualTo("");
        }

        @Test
        void shouldResolveNodeTypeNames() {
            assertThat(NodeType.fromTypeName("function")).isEqualTo(NodeType.FUNCTION);
            assertThatThrownBy(() -> NodeType.fromTypeName("loop"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Branches {

        @Test
        void shouldMapHandles() {
            assertThat(Branch.fromHandle("true")).isEqualTo(Branch.TRUE);
            assertThat(Branch.fromHandle("FALSE")).isEqualTo(Branch.FALSE);
            assertThat(Branch.fromHandle(null)).isNull();
            assertThat(Branch.FALSE.handle()).isEqualTo("false");
        }

        @Test
        void shouldServeOnlyMatchingOutcome() {
            Edge plain = new Edge("e", "a", "b");

            assertThat(plain.serves(Branch.TRUE)).isFalse();
            assertThat(new Edge("e", "a", "b", Branch.TRUE).serves(Branch.TRUE)).isTrue();
        }
    }
}
