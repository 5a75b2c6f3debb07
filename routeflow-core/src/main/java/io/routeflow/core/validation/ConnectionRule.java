package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.List;

/// Checks that every node has the edges its kind needs.
///
/// Start nodes need an outgoing edge, End nodes an incoming one, and every other node both.
final class ConnectionRule implements ValidationRule {

    @Override
    public List<ValidationIssue> check(FlowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            boolean hasOutgoing = !graph.edgesFrom(node.getId()).isEmpty();
            boolean hasIncoming = !graph.edgesTo(node.getId()).isEmpty();
            NodeType type = node.getNodeType();
            if (type == NodeType.START) {
                if (!hasOutgoing) {
                    issues.add(
                            ValidationIssue.forNode(
                                    IssueKind.DISCONNECTED_START,
                                    "Start node \"" + node.getLabel()
                                            + "\" is not connected to any other nodes",
                                    node.getId()));
                }
            } else if (type == NodeType.END) {
                if (!hasIncoming) {
                    issues.add(
                            ValidationIssue.forNode(
                                    IssueKind.ORPHANED_END,
                                    "End node \"" + node.getLabel()
                                            + "\" is not connected from any other nodes",
                                    node.getId()));
                }
            } else if (!hasIncoming || !hasOutgoing) {
                issues.add(
                        ValidationIssue.forNode(
                                IssueKind.ORPHANED_NODE,
                                type.displayName() + " node \"" + node.getLabel()
                                        + "\" is not properly connected",
                                node.getId()));
            }
        }
        return issues;
    }
}
