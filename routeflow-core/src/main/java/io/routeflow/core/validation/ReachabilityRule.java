package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Warns about nodes no Start node leads to. A node counts as reachable when any Start does.
final class ReachabilityRule implements ValidationRule {

    @Override
    public List<ValidationIssue> check(FlowGraph graph) {
        Set<String> reachable = Reachability.fromStarts(graph);
        List<ValidationIssue> issues = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            if (node.getNodeType() == NodeType.START || reachable.contains(node.getId())) {
                continue;
            }
            issues.add(
                    ValidationIssue.forNode(
                            IssueKind.UNREACHABLE_NODE,
                            node.getNodeType().displayName() + " node \"" + node.getLabel()
                                    + "\" is unreachable from Start node",
                            node.getId()));
        }
        return issues;
    }
}
