package io.routeflow.core.graph;

import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import io.routeflow.core.graph.node.StartNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Immutable directed graph of flow steps.
///
/// A graph is a plain value: nodes in authoring order, edges in authoring order, and
/// {@link GraphMetadata}. No structural checks run here. Dangling edges and duplicate node ids
/// are representable so that {@link io.routeflow.core.validation.FlowValidator} can report them.
///
/// ### Editing
/// Every edit returns a new graph and leaves the receiver untouched:
/// {@snippet :
/// FlowGraph g2 = g1.withNode(node).connect("start_1", node.getId(), null);
/// }
///
/// ### Identifiers
/// {@link #nextNodeId(NodeType)} derives a fresh id from the ids already present in this graph,
/// so two graphs never share a counter.
///
/// @implNote Immutable and thread-safe. Collections are unmodifiable copies.
///
/// @see Node for the node hierarchy
/// @see Edge for connections
public final class FlowGraph {

    private static final Pattern SEQUENCED_ID = Pattern.compile("^[A-Za-z_]+?_(\\d+)$");

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final GraphMetadata metadata;

    private FlowGraph(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.metadata = builder.metadata != null ? builder.metadata : GraphMetadata.EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns an empty graph.
    public static FlowGraph empty() {
        return builder().build();
    }

    /// Returns all nodes in authoring order.
    ///
    /// @return unmodifiable node list, never null
    public List<Node> getNodes() {
        return nodes;
    }

    /// Returns all edges in authoring order.
    ///
    /// @return unmodifiable edge list, never null
    public List<Edge> getEdges() {
        return edges;
    }

    /// @return metadata, never null
    public GraphMetadata getMetadata() {
        return metadata;
    }

    // --- Queries ---

    /// Looks up a node by id. When ids are duplicated the first match wins.
    ///
    /// @param id node id, may be null
    /// @return the node, or empty if absent
    public Optional<Node> node(String id) {
        for (Node node : nodes) {
            if (node.getId().equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /// Returns whether a node with the given id exists.
    public boolean containsNode(String id) {
        return node(id).isPresent();
    }

    /// Returns the nodes of one kind in authoring order.
    ///
    /// @param type node kind, not null
    /// @return matching nodes, never null
    public List<Node> nodesOfKind(NodeType type) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.getNodeType() == type) {
                result.add(node);
            }
        }
        return result;
    }

    /// Returns the first Start node, the one a simulation run begins at.
    ///
    /// @return first start node in authoring order, or empty if none
    public Optional<StartNode> firstStart() {
        for (Node node : nodes) {
            if (node instanceof StartNode start) {
                return Optional.of(start);
            }
        }
        return Optional.empty();
    }

    /// Returns the edges leaving a node.
    ///
    /// @param nodeId source node id
    /// @return outgoing edges in authoring order, never null
    public List<Edge> edgesFrom(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.source().equals(nodeId)) {
                result.add(edge);
            }
        }
        return result;
    }

    /// Returns the edges leaving a node that serve one condition outcome.
    ///
    /// @param nodeId source node id
    /// @param branch outcome to match, not null
    /// @return matching edges in authoring order, never null
    public List<Edge> edgesFrom(String nodeId, Branch branch) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.source().equals(nodeId) && edge.serves(branch)) {
                result.add(edge);
            }
        }
        return result;
    }

    /// Returns the edges entering a node.
    ///
    /// @param nodeId target node id
    /// @return incoming edges in authoring order, never null
    public List<Edge> edgesTo(String nodeId) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.target().equals(nodeId)) {
                result.add(edge);
            }
        }
        return result;
    }

    // --- Identifiers ---

    /// Derives an unused node id of the form `<type>_<n>`.
    ///
    /// `n` is one more than the highest numeric suffix among the ids in this graph. Suffixes of
    /// any length count, including the timestamp ids some editors generate.
    ///
    /// @param type kind of the node being created, not null
    /// @return fresh node id, never null
    public String nextNodeId(NodeType type) {
        BigInteger highest = BigInteger.ZERO;
        for (Node node : nodes) {
            Matcher matcher = SEQUENCED_ID.matcher(node.getId());
            if (matcher.matches()) {
                highest = highest.max(new BigInteger(matcher.group(1)));
            }
        }
        return type.typeName() + "_" + highest.add(BigInteger.ONE);
    }

    /// Derives an unused edge id for a connection.
    private String nextEdgeId(String source, String target) {
        String base = "edge_" + source + "_" + target;
        String candidate = base;
        int suffix = 2;
        while (hasEdge(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private boolean hasEdge(String edgeId) {
        for (Edge edge : edges) {
            if (edge.id().equals(edgeId)) {
                return true;
            }
        }
        return false;
    }

    // --- Copy-on-write edits ---

    /// Returns a graph with the node added, or replacing the first node with the same id.
    ///
    /// @param node node to add or replace, not null
    /// @return new graph, never null
    public FlowGraph withNode(Node node) {
        Objects.requireNonNull(node, "node");
        List<Node> copy = new ArrayList<>(nodes);
        boolean replaced = false;
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getId().equals(node.getId())) {
                copy.set(i, node);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            copy.add(node);
        }
        return toBuilder().nodes(copy).build();
    }

    /// Returns a graph without the node and without any edge touching it.
    ///
    /// @param nodeId id of the node to remove
    /// @return new graph, never null
    public FlowGraph withoutNode(String nodeId) {
        List<Node> keptNodes = new ArrayList<>();
        for (Node node : nodes) {
            if (!node.getId().equals(nodeId)) {
                keptNodes.add(node);
            }
        }
        List<Edge> keptEdges = new ArrayList<>();
        for (Edge edge : edges) {
            if (!edge.source().equals(nodeId) && !edge.target().equals(nodeId)) {
                keptEdges.add(edge);
            }
        }
        return toBuilder().nodes(keptNodes).edges(keptEdges).build();
    }

    /// Returns a graph with the edge added, or replacing the edge with the same id.
    ///
    /// @param edge edge to add, not null
    /// @return new graph, never null
    public FlowGraph withEdge(Edge edge) {
        Objects.requireNonNull(edge, "edge");
        List<Edge> copy = new ArrayList<>();
        for (Edge existing : edges) {
            if (!existing.id().equals(edge.id())) {
                copy.add(existing);
            }
        }
        copy.add(edge);
        return toBuilder().edges(copy).build();
    }

    /// Returns a graph without the edge.
    ///
    /// @param edgeId id of the edge to remove
    /// @return new graph, never null
    public FlowGraph withoutEdge(String edgeId) {
        List<Edge> copy = new ArrayList<>();
        for (Edge edge : edges) {
            if (!edge.id().equals(edgeId)) {
                copy.add(edge);
            }
        }
        return toBuilder().edges(copy).build();
    }

    /// Returns a graph with a new edge between two nodes, using a generated edge id.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param branch condition outcome, null for an unconditional edge
    /// @return new graph, never null
    public FlowGraph connect(String source, String target, Branch branch) {
        return withEdge(new Edge(nextEdgeId(source, target), source, target, branch));
    }

    /// Returns a graph with replaced metadata.
    public FlowGraph withMetadata(GraphMetadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }

    /// Returns a builder pre-populated with this graph's content.
    public Builder toBuilder() {
        return new Builder().nodes(nodes).edges(edges).metadata(metadata);
    }

    /// Builder for FlowGraph. All fields are optional.
    public static final class Builder {
        private List<Node> nodes = new ArrayList<>();
        private List<Edge> edges = new ArrayList<>();
        private GraphMetadata metadata;

        private Builder() {}

        public Builder nodes(List<? extends Node> nodes) {
            this.nodes = new ArrayList<>(nodes);
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "node"));
            return this;
        }

        public Builder edges(List<Edge> edges) {
            this.edges = new ArrayList<>(edges);
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(Objects.requireNonNull(edge, "edge"));
            return this;
        }

        /// Adds an edge with id `edge_<source>_<target>`.
        public Builder edge(String source, String target) {
            return edge(source, target, null);
        }

        /// Adds a branch edge with id `edge_<source>_<target>`.
        public Builder edge(String source, String target, Branch branch) {
            return edge(new Edge("edge_" + source + "_" + target, source, target, branch));
        }

        public Builder metadata(GraphMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public FlowGraph build() {
            return new FlowGraph(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowGraph graph)) return false;
        return nodes.equals(graph.nodes)
                && edges.equals(graph.edges)
                && metadata.equals(graph.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges, metadata);
    }

    @Override
    public String toString() {
        return "FlowGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
