package io.routeflow.core.graph;

import java.util.Objects;

/// Directed connection between two nodes.
///
/// Endpoints are plain ids; an edge may reference a node that does not exist. Such dangling
/// edges are kept and reported by the validator instead of being dropped.
///
/// @param id edge identifier, not null
/// @param source id of the node the edge leaves, not null
/// @param target id of the node the edge enters, not null
/// @param branch condition outcome this edge serves, null for unconditional edges
public record Edge(String id, String source, String target, Branch branch) {

    public Edge {
        Objects.requireNonNull(id, "Edge id required");
        Objects.requireNonNull(source, "Edge source required");
        Objects.requireNonNull(target, "Edge target required");
    }

    /// Creates an unconditional edge.
    public Edge(String id, String source, String target) {
        this(id, source, target, null);
    }

    /// Returns whether this edge serves the given branch.
    public boolean serves(Branch outcome) {
        return branch == outcome;
    }
}
