package io.routeflow.core.graph.node;

import java.util.Objects;

/// Binds a literal value to a named variable when the walk passes through.
///
/// The literal is kept as authored. {@link #parsedValue()} turns numeric-looking text into a
/// number and leaves everything else as a string.
public final class InputNode extends Node {

    private final String variableName;
    private final String literalValue;

    private InputNode(Builder builder) {
        super(builder.id, builder.label, builder.position);
        this.variableName = builder.variableName;
        this.literalValue = builder.literalValue != null ? builder.literalValue : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the variable the literal is bound to.
    ///
    /// @return variable name, never null
    public String getVariableName() {
        return variableName;
    }

    /// Returns the literal text as authored.
    ///
    /// @return literal value, never null (may be empty)
    public String getLiteralValue() {
        return literalValue;
    }

    /// Returns the literal parsed to a `Double` when it looks numeric, otherwise the raw text.
    ///
    /// @return number or string, never null
    public Object parsedValue() {
        return parseLiteral(literalValue);
    }

    /// Parses the literal text of an Input node.
    ///
    /// @param text literal text, may be null
    /// @return `Double` for numeric text, otherwise the text itself (empty for null)
    public static Object parseLiteral(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (!trimmed.isEmpty() && trimmed.matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?")) {
            return Double.parseDouble(trimmed);
        }
        return text;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INPUT;
    }

    @Override
    protected boolean payloadEquals(Node other) {
        InputNode that = (InputNode) other;
        return Objects.equals(variableName, that.variableName)
                && Objects.equals(literalValue, that.literalValue);
    }

    /// Builder for InputNode. Required fields: `id`, `variableName`.
    public static final class Builder {
        private String id;
        private String label;
        private Position position;
        private String variableName;
        private String literalValue;

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

        public Builder variableName(String variableName) {
            this.variableName = variableName;
            return this;
        }

        public Builder literalValue(String literalValue) {
            this.literalValue = literalValue;
            return this;
        }

        /// @throws IllegalStateException if `id` or `variableName` is blank
        public InputNode build() {
            requireId(id, "InputNode");
            if (variableName == null || variableName.isBlank()) {
                throw new IllegalStateException("InputNode variableName is required");
            }
            return new InputNode(this);
        }
    }
}
