package io.routeflow.core.expression;

/// Outcome of evaluating a condition.
///
/// @param value truthiness of the expression's value
/// @param displayExpression the expression after substitution, for audit display
public record ConditionResult(boolean value, String displayExpression) {}
