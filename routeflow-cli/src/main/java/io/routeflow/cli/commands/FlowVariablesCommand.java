package io.routeflow.cli.commands;

import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.analysis.DetectedVariable;
import io.routeflow.core.graph.FlowGraph;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// CLI command listing the test variables a flow's conditions reference.
///
/// ### Usage
/// ```bash
/// routeflow variables [-d <working-dir>] <flow.json>
/// ```
///
/// Prints one row per variable, then a ready-made `simulate` argument list with the default
/// test values.
///
/// @see io.routeflow.core.analysis.VariableDetector
@Command(name = "variables", description = "List the test variables a flow references")
class FlowVariablesCommand extends FlowCommand {

    @Parameters(index = "0", description = "Flow file (graph JSON or saved flow)")
    private String flowFile;

    @Override
    protected void execute() {
        FlowGraph graph;
        try {
            graph = loadGraph(flowFile);
        } catch (FlowFileException e) {
            System.err.println(" [FAIL] " + e.getMessage());
            return;
        }

        AnsiStyles styles = styles();
        List<DetectedVariable> variables = environment.getVariableDetector().detect(graph);
        if (variables.isEmpty()) {
            System.out.println("  No test variables referenced.");
            return;
        }

        System.out.println(
                "  "
                        + styles.bold(
                                styles.padRight("NAME", 20)
                                        + styles.padRight("KIND", 9)
                                        + styles.padRight("TYPE", 8)
                                        + styles.padRight("DEFAULT", 12)
                                        + "USED BY"));
        StringBuilder arguments = new StringBuilder();
        for (DetectedVariable variable : variables) {
            String defaultValue = variable.defaultValue() != null ? variable.defaultValue() : "-";
            System.out.println(
                    "  "
                            + styles.padRight(variable.name(), 20)
                            + styles.padRight(lower(variable.kind().name()), 9)
                            + styles.padRight(lower(variable.dataType().name()), 8)
                            + styles.padRight(defaultValue, 12)
                            + styles.gray(String.join(", ", variable.usedBy())));
            if (variable.defaultValue() != null) {
                arguments
                        .append(" -c ")
                        .append(variable.name())
                        .append('=')
                        .append(variable.defaultValue());
            }
        }
        if (arguments.length() > 0) {
            System.out.println();
            System.out.println(styles.gray("  Defaults:" + arguments));
        }
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
