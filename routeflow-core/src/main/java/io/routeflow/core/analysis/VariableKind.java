package io.routeflow.core.analysis;

/// How a test variable is referenced in a condition.
public enum VariableKind {
    /// `${name}`
    SYSTEM,
    /// `session['key']`
    SESSION,
    /// bare identifier
    PLAIN
}
