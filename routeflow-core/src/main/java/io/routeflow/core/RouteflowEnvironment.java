package io.routeflow.core;

import io.routeflow.core.analysis.VariableDetector;
import io.routeflow.core.execution.FlowSimulator;
import io.routeflow.core.expression.ExpressionEvaluator;
import io.routeflow.core.validation.FlowValidator;
import io.routeflow.core.validation.OverlapDetector;
import java.util.Objects;

/// Wired set of engine components sharing one {@link RouteflowConfig}.
///
/// @implNote Immutable and thread-safe. Every component is stateless after construction.
///
/// @see RouteflowFactory
public final class RouteflowEnvironment {

    private final RouteflowConfig config;
    private final FlowValidator validator;
    private final OverlapDetector overlapDetector;
    private final ExpressionEvaluator expressionEvaluator;
    private final FlowSimulator simulator;
    private final VariableDetector variableDetector;

    RouteflowEnvironment(
            RouteflowConfig config,
            FlowValidator validator,
            OverlapDetector overlapDetector,
            ExpressionEvaluator expressionEvaluator,
            FlowSimulator simulator,
            VariableDetector variableDetector) {
        this.config = Objects.requireNonNull(config, "config required");
        this.validator = Objects.requireNonNull(validator, "validator required");
        this.overlapDetector = Objects.requireNonNull(overlapDetector, "overlapDetector required");
        this.expressionEvaluator =
                Objects.requireNonNull(expressionEvaluator, "expressionEvaluator required");
        this.simulator = Objects.requireNonNull(simulator, "simulator required");
        this.variableDetector =
                Objects.requireNonNull(variableDetector, "variableDetector required");
    }

    public RouteflowConfig getConfig() {
        return config;
    }

    public FlowValidator getValidator() {
        return validator;
    }

    public OverlapDetector getOverlapDetector() {
        return overlapDetector;
    }

    public ExpressionEvaluator getExpressionEvaluator() {
        return expressionEvaluator;
    }

    public FlowSimulator getSimulator() {
        return simulator;
    }

    public VariableDetector getVariableDetector() {
        return variableDetector;
    }
}
