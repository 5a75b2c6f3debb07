package io.routeflow.core.expression;

/// User-facing description of an expression failure.
///
/// @param kind failure category
/// @param identifier offending identifier, or null
/// @param message what went wrong
/// @param suggestion how to fix it
public record ExpressionError(
        ErrorKind kind, String identifier, String message, String suggestion) {}
