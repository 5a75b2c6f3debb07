package io.routeflow.core.expression;

import io.routeflow.core.expression.helper.HelperContext;
import io.routeflow.core.expression.helper.HelperNamespaces;
import io.routeflow.core.expression.helper.QueueDefaults;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Evaluates condition expressions.
///
/// The expression is first substituted by {@link ExpressionSubstitutor}; the substituted text
/// is then parsed and evaluated in a scope holding the environment variables and the four
/// helper namespaces (`queue`, `date`, `now`, `today`) bound to the configuration.
///
/// ### Contracts
/// - **Deterministic**: the same expression, environment and configuration always yield the
///   same {@link ConditionResult}, provided the clock is fixed or the configuration supplies
///   `date`, `now` and `today`.
/// - **Sandboxed**: nothing outside the scope is reachable; see {@link Expr}.
///
/// @implNote Thread-safe. Holds only immutable collaborators.
///
/// @see ExpressionDiagnostics for reporting failures
public final class ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final Clock clock;
    private final QueueDefaults queueDefaults;
    private final ExpressionSubstitutor substitutor = new ExpressionSubstitutor();

    public ExpressionEvaluator(Clock clock, QueueDefaults queueDefaults) {
        this.clock = Objects.requireNonNull(clock, "clock required");
        this.queueDefaults = Objects.requireNonNull(queueDefaults, "queueDefaults required");
    }

    /// Creates an evaluator on the system clock with default queue figures.
    public ExpressionEvaluator() {
        this(Clock.systemDefaultZone(), QueueDefaults.DEFAULT);
    }

    /// Evaluates a condition.
    ///
    /// @param expression condition text, not null
    /// @param environment variables bound by earlier nodes, not null
    /// @param configuration test configuration, not null
    /// @return boolean outcome and display expression, never null
    /// @throws ExpressionException on a syntax error, unresolved reference or invalid operation
    public ConditionResult evaluate(
            String expression, Map<String, ?> environment, Map<String, String> configuration) {
        String display = substitute(expression, environment, configuration);
        Expr tree = ExpressionParser.parseExpression(display);
        HelperContext context = new HelperContext(configuration, clock, queueDefaults);
        EvaluationScope scope =
                EvaluationScope.of(environment, HelperNamespaces.standard(context));
        boolean value = Values.isTruthy(tree.evaluate(scope));
        logger.fine(() -> "Condition [" + display + "] = " + value);
        return new ConditionResult(value, display);
    }

    /// Returns the display form of an expression without evaluating it.
    public String substitute(
            String expression, Map<String, ?> environment, Map<String, String> configuration) {
        return substitutor.substitute(expression, environment, configuration);
    }
}
