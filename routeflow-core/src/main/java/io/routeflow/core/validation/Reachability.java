package io.routeflow.core.validation;

import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/// Forward reachability over directed edges.
public final class Reachability {

    private Reachability() {}

    /// Returns the ids of every Start node and every node reachable from any of them.
    ///
    /// Edges whose target is not a node id are ignored.
    ///
    /// @param graph graph to traverse, not null
    /// @return reachable node ids in breadth-first discovery order, never null
    public static Set<String> fromStarts(FlowGraph graph) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Node start : graph.nodesOfKind(NodeType.START)) {
            if (reached.add(start.getId())) {
                queue.add(start.getId());
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Edge edge : graph.edgesFrom(current)) {
                if (graph.containsNode(edge.target()) && reached.add(edge.target())) {
                    queue.add(edge.target());
                }
            }
        }
        return reached;
    }
}
