package io.routeflow.core.graph.node;

import java.util.Objects;

/// Base class for all flow graph node types.
///
/// Each node has an identifier that is expected (but not enforced) to be unique within its
/// graph, a display label, and an optional canvas position.
///
/// ### Node Types
/// - {@link StartNode} - Entry point of a walk
/// - {@link InputNode} - Binds a literal value to a variable
/// - {@link ConditionNode} - Branches on a boolean expression
/// - {@link FunctionNode} - Computes new variables from a small statement body
/// - {@link EndNode} - Terminates a path, optionally linking to another rule
///
/// @implNote Subclasses are immutable. Edits go through the subclass builders and
/// {@link io.routeflow.core.graph.FlowGraph#withNode(Node)}.
///
/// @see NodeType
public abstract class Node {

    protected final String id;
    protected final String label;
    protected final Position position;

    protected Node(String id, String label, Position position) {
        this.id = id;
        this.label = label != null ? label : getNodeType().displayName();
        this.position = position;
    }

    /// Returns the node identifier.
    ///
    /// @return node ID, never null
    public String getId() {
        return id;
    }

    /// Returns the display label.
    ///
    /// @return label, never null
    public String getLabel() {
        return label;
    }

    /// Returns the canvas position.
    ///
    /// @return position, or null if the node was never placed
    public Position getPosition() {
        return position;
    }

    /// Returns the node type used for dispatch.
    ///
    /// @return the node type, never null
    public abstract NodeType getNodeType();

    static void requireId(String id, String type) {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException(type + " id is required");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(id, node.id)
                && Objects.equals(label, node.label)
                && Objects.equals(position, node.position)
                && payloadEquals(node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNodeType(), id, label);
    }

    /// Compares the kind-specific payload with another node of the same class.
    protected abstract boolean payloadEquals(Node other);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', label='" + label + "'}";
    }
}
