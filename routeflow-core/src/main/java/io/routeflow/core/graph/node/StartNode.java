package io.routeflow.core.graph.node;

import java.util.Objects;

/// Entry point of a flow.
///
/// The optional `idLabel` tags the node with the identifier of the external rule document it
/// was imported from, so an exporter or navigation layer can tell graphs apart.
public final class StartNode extends Node {

    private final String idLabel;

    private StartNode(Builder builder) {
        super(builder.id, builder.label, builder.position);
        this.idLabel = builder.idLabel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the external-identifier tag.
    ///
    /// @return rule identifier, or null when the graph was authored directly
    public String getIdLabel() {
        return idLabel;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.START;
    }

    @Override
    protected boolean payloadEquals(Node other) {
        return Objects.equals(idLabel, ((StartNode) other).idLabel);
    }

    /// Builder for StartNode. Required field: `id`.
    public static final class Builder {
        private String id;
        private String label;
        private Position position;
        private String idLabel;

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

        public Builder idLabel(String idLabel) {
            this.idLabel = idLabel;
            return this;
        }

        /// @throws IllegalStateException if `id` is blank
        public StartNode build() {
            requireId(id, "StartNode");
            return new StartNode(this);
        }
    }
}
