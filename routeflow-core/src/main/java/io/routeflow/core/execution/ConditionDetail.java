package io.routeflow.core.execution;

/// Audit data for one condition evaluation.
///
/// @param originalExpression expression as authored
/// @param substitutedExpression expression after variable substitution
/// @param result outcome, or null when evaluation failed
public record ConditionDetail(
        String originalExpression, String substitutedExpression, Boolean result) {}
