package io.routeflow.core.analysis;

import java.util.List;

/// A variable a simulation run may need a configured value for.
///
/// @param name variable name or session key
/// @param kind how the variable is referenced
/// @param dataType guessed type
/// @param defaultValue suggested test value, or null when none applies
/// @param usedBy ids of the Condition nodes referencing it, in authoring order
public record DetectedVariable(
        String name,
        VariableKind kind,
        DataType dataType,
        String defaultValue,
        List<String> usedBy) {

    public DetectedVariable {
        usedBy = List.copyOf(usedBy);
    }
}
