package io.routeflow.core.graph.node;

import java.util.Objects;

/// Branching step. The expression is evaluated against the current variables and the walk
/// continues along the outgoing edges whose branch matches the result.
///
/// @see io.routeflow.core.expression.ExpressionEvaluator
public final class ConditionNode extends Node {

    private final String expression;

    private ConditionNode(Builder builder) {
        super(builder.id, builder.label, builder.position);
        this.expression = builder.expression;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the boolean expression.
    ///
    /// @return expression text, never null
    public String getExpression() {
        return expression;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.CONDITION;
    }

    @Override
    protected boolean payloadEquals(Node other) {
        return Objects.equals(expression, ((ConditionNode) other).expression);
    }

    /// Builder for ConditionNode. Required fields: `id`, `expression`.
    public static final class Builder {
        private String id;
        private String label;
        private Position position;
        private String expression;

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

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        /// @throws IllegalStateException if `id` is blank or `expression` is null
        public ConditionNode build() {
            requireId(id, "ConditionNode");
            if (expression == null) {
                throw new IllegalStateException("ConditionNode expression is required");
            }
            return new ConditionNode(this);
        }
    }
}
