package io.routeflow.core.graph.node;

import java.util.Objects;

/// Transform step. The body is a short statement sequence (`let`, assignment, `return`) whose
/// returned value is either merged into the variables (object literal) or bound to `result`.
///
/// @see io.routeflow.core.execution.FunctionBodyEvaluator
public final class FunctionNode extends Node {

    private final String body;

    private FunctionNode(Builder builder) {
        super(builder.id, builder.label, builder.position);
        this.body = builder.body != null ? builder.body : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the statement body.
    ///
    /// @return body text, never null (may be empty)
    public String getBody() {
        return body;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.FUNCTION;
    }

    @Override
    protected boolean payloadEquals(Node other) {
        return Objects.equals(body, ((FunctionNode) other).body);
    }

    /// Builder for FunctionNode. Required field: `id`.
    public static final class Builder {
        private String id;
        private String label;
        private Position position;
        private String body;

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

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public FunctionNode build() {
            requireId(id, "FunctionNode");
            return new FunctionNode(this);
        }
    }
}
