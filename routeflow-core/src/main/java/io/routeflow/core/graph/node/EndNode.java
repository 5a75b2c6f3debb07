package io.routeflow.core.graph.node;

import java.util.Objects;
import java.util.Optional;

/// Terminal step of a path.
///
/// An End node may point at another rule by name through {@link #getLinkTarget()}. The link is
/// a typed field rather than something parsed out of the label, so renaming the label never
/// breaks navigation.
///
/// @implNote Immutable and thread-safe after construction.
public final class EndNode extends Node {

    private final String linkTarget;

    private EndNode(Builder builder) {
        super(builder.id, builder.label, builder.position);
        this.linkTarget = builder.linkTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the name of the rule this end hands over to.
    ///
    /// @return linked rule name, or empty if this end terminates the flow
    public Optional<String> getLinkTarget() {
        return Optional.ofNullable(linkTarget);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.END;
    }

    @Override
    protected boolean payloadEquals(Node other) {
        return Objects.equals(linkTarget, ((EndNode) other).linkTarget);
    }

    /// Builder for EndNode. Required field: `id`.
    public static final class Builder {
        private String id;
        private String label;
        private Position position;
        private String linkTarget;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        /// Sets the linked rule name; blank values are treated as no link.
        public Builder linkTarget(String linkTarget) {
            this.linkTarget = linkTarget == null || linkTarget.isBlank() ? null : linkTarget;
            return this;
        }

        /// @throws IllegalStateException if `id` is blank
        public EndNode build() {
            requireId(id, "EndNode");
            return new EndNode(this);
        }
    }
}
