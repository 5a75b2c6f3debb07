package io.routeflow.core.validation;

import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Reports duplicated node ids and edges whose endpoints do not resolve.
final class IntegrityRule implements ValidationRule {

    @Override
    public List<ValidationIssue> check(FlowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (Node node : graph.getNodes()) {
            if (!seen.add(node.getId()) && reported.add(node.getId())) {
                issues.add(
                        ValidationIssue.forNode(
                                IssueKind.DUPLICATE_NODE_ID,
                                "Node id \"" + node.getId() + "\" is used by more than one node",
                                node.getId()));
            }
        }
        for (Edge edge : graph.getEdges()) {
            for (String endpoint : List.of(edge.source(), edge.target())) {
                if (!seen.contains(endpoint)) {
                    issues.add(
                            ValidationIssue.forNode(
                                    IssueKind.DANGLING_EDGE,
                                    "Edge \"" + edge.id() + "\" references missing node \""
                                            + endpoint + "\"",
                                    endpoint));
                }
            }
        }
        return issues;
    }
}
