package io.routeflow.core.graph.node;

import java.util.Locale;

/// Kinds of steps a flow graph can contain.
public enum NodeType {
    START,
    INPUT,
    CONDITION,
    FUNCTION,
    END;

    /// Returns the lower-case name used in graph JSON and user-facing messages.
    ///
    /// @return type name such as `"condition"`, never null
    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Returns the capitalized name used in labels and messages, such as `"Condition"`.
    public String displayName() {
        String name = typeName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /// Resolves a type from its graph JSON name.
    ///
    /// @param typeName case-insensitive type name, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if no type has that name
    public static NodeType fromTypeName(String typeName) {
        for (NodeType type : values()) {
            if (type.typeName().equalsIgnoreCase(typeName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + typeName);
    }
}
