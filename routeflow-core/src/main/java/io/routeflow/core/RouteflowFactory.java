package io.routeflow.core;

import io.routeflow.core.analysis.VariableDetector;
import io.routeflow.core.execution.FlowSimulator;
import io.routeflow.core.execution.FunctionBodyEvaluator;
import io.routeflow.core.expression.ExpressionEvaluator;
import io.routeflow.core.validation.FlowValidator;
import io.routeflow.core.validation.OverlapDetector;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates and wires {@link RouteflowEnvironment} instances.
///
/// {@snippet :
/// var env = RouteflowFactory.createEnvironment(
///     RouteflowConfig.builder().clock(fixedClock).maxSteps(200).build());
/// ExecutionTrace trace = env.getSimulator().simulate(graph, Map.of("age", "25"));
/// }
///
/// @see RouteflowEnvironment
/// @see RouteflowConfig
public final class RouteflowFactory {

    private static final Logger logger = Logger.getLogger(RouteflowFactory.class.getName());

    private RouteflowFactory() {}

    /// Creates an environment with default configuration.
    ///
    /// @return wired environment, never null
    public static RouteflowEnvironment createEnvironment() {
        return createEnvironment(new RouteflowConfig());
    }

    /// Creates an environment.
    ///
    /// @param config configuration, not null
    /// @return wired environment, never null
    /// @throws IllegalArgumentException if `maxSteps` is not positive
    public static RouteflowEnvironment createEnvironment(RouteflowConfig config) {
        Objects.requireNonNull(config, "config required");
        ExpressionEvaluator evaluator =
                new ExpressionEvaluator(config.getClock(), config.getQueueDefaults());
        FlowSimulator simulator =
                new FlowSimulator(evaluator, new FunctionBodyEvaluator(), config.getMaxSteps());
        logger.fine(() -> "Created Routeflow environment with maxSteps=" + config.getMaxSteps());
        return new RouteflowEnvironment(
                config,
                new FlowValidator(),
                new OverlapDetector(),
                evaluator,
                simulator,
                new VariableDetector());
    }
}
