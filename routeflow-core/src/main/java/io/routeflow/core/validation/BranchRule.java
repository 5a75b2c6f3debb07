package io.routeflow.core.validation;

import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.List;

/// Warns when a Condition node lacks a TRUE or FALSE edge.
final class BranchRule implements ValidationRule {

    @Override
    public List<ValidationIssue> check(FlowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Node condition : graph.nodesOfKind(NodeType.CONDITION)) {
            if (graph.edgesFrom(condition.getId(), Branch.TRUE).isEmpty()) {
                issues.add(missing(IssueKind.MISSING_TRUE_PATH, condition, "TRUE"));
            }
            if (graph.edgesFrom(condition.getId(), Branch.FALSE).isEmpty()) {
                issues.add(missing(IssueKind.MISSING_FALSE_PATH, condition, "FALSE"));
            }
        }
        return issues;
    }

    private static ValidationIssue missing(IssueKind kind, Node condition, String branch) {
        return ValidationIssue.forNode(
                kind,
                "Condition node \"" + condition.getLabel() + "\" is missing " + branch + " path",
                condition.getId());
    }
}
