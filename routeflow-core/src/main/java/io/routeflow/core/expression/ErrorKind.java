package io.routeflow.core.expression;

/// Categories of expression failures, each with its own remediation hint.
public enum ErrorKind {
    /// The text does not parse.
    SYNTAX,
    /// An identifier, `${...}` or `session[...]` reference has no bound value.
    UNRESOLVED_REFERENCE,
    /// A property or method was read from `null`.
    NULL_ACCESS,
    /// A value was used in a way its type does not support, such as calling a non-method.
    TYPE_ERROR
}
