package io.routeflow.cli.execution;

import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.execution.ConditionDetail;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.execution.SimulationListener;
import io.routeflow.core.execution.StepRecord;
import java.io.PrintStream;

/// Simulation listener that prints each trace entry as it is recorded.
///
/// ### Output Format
/// ```
///   INFO  [condition_3] Condition "age >= 18" → "25 >= 18" = true
///   ERROR [condition_5] Error evaluating condition: score is not defined
///         Variable "score" not found. Available variables: age
/// ```
///
/// @implNote **Not thread-safe**. One instance per run.
/// @see io.routeflow.core.execution.SimulationListener
public class ConsoleSimulationListener implements SimulationListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public ConsoleSimulationListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onStep(StepRecord step) {
        String level = styles.padRight(step.getLevel().name(), 5);
        String styledLevel =
                switch (step.getLevel()) {
                    case INFO -> styles.gray(level);
                    case WARNING -> styles.warn(level);
                    case ERROR -> styles.error(level);
                };
        out.printf("  %s [%s] %s%n", styledLevel, step.getNodeId(), step.getMessage());
        ConditionDetail detail = step.getConditionDetail();
        if (detail != null && detail.result() == null) {
            out.println("        " + styles.dim("substituted: " + detail.substitutedExpression()));
        }
        if (step.getSuggestion() != null) {
            out.println("        " + styles.gray(step.getSuggestion()));
        }
    }

    @Override
    public void onComplete(ExecutionTrace trace) {
        out.println(styles.separator());
    }
}
