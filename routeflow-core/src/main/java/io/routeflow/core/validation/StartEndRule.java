package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.List;

/// Requires at least one Start and one End; warns about several Start nodes.
final class StartEndRule implements ValidationRule {

    @Override
    public List<ValidationIssue> check(FlowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<Node> starts = graph.nodesOfKind(NodeType.START);
        if (starts.isEmpty()) {
            issues.add(
                    ValidationIssue.of(
                            IssueKind.MISSING_START, "Flow must have at least one Start node"));
        } else if (starts.size() > 1) {
            List<String> ids = new ArrayList<>();
            for (Node start : starts) {
                ids.add(start.getId());
            }
            issues.add(
                    ValidationIssue.forNodes(
                            IssueKind.MULTIPLE_STARTS,
                            "Multiple Start nodes found - only one will be used for execution",
                            ids));
        }
        if (graph.nodesOfKind(NodeType.END).isEmpty()) {
            issues.add(
                    ValidationIssue.of(
                            IssueKind.MISSING_END, "Flow must have at least one End node"));
        }
        return issues;
    }
}
