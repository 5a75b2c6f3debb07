package io.routeflow.cli.commands;

import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.cli.execution.ConsoleSimulationListener;
import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.execution.SimulationListener;
import io.routeflow.core.execution.StepLevel;
import io.routeflow.core.execution.StepRecord;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.serialization.FlowSerializer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for simulating a flow run.
///
/// ### Usage
/// ```bash
/// routeflow simulate [-d <working-dir>] [-v] [--defaults] [--json] [-c key=value]... <flow.json>
/// ```
///
/// ### Options
/// - `-c, --config` - Test variable, repeatable; values are passed on as strings
/// - `--defaults` - Pre-fill detected system and session variables with default test values;
///   `-c` entries win
/// - `-v, --verbose` - Print every trace entry as it is recorded
/// - `--json` - Print the trace as JSON instead of text
///
/// @see io.routeflow.core.execution.FlowSimulator
@Command(name = "simulate", description = "Simulate a flow run with test variables")
class FlowSimulateCommand extends FlowCommand {

    @Parameters(index = "0", description = "Flow file (graph JSON or saved flow)")
    private String flowFile;

    @Option(
            names = {"-c", "--config"},
            description = "Test variable as key=value (repeatable)")
    private Map<String, String> configuration = new LinkedHashMap<>();

    @Option(
            names = {"--defaults"},
            description = "Pre-fill detected variables with default test values")
    private boolean useDefaults = false;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print every trace entry as it is recorded")
    private boolean verbose = false;

    @Option(
            names = {"--json"},
            description = "Print the trace as JSON")
    private boolean json = false;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        FlowGraph graph;
        try {
            graph = loadGraph(flowFile);
        } catch (FlowFileException e) {
            System.err.println(" [FAIL] Simulation failed: " + e.getMessage());
            return;
        }

        Map<String, String> effective = new LinkedHashMap<>();
        if (useDefaults) {
            effective.putAll(environment.getVariableDetector().defaultConfiguration(graph));
        }
        if (configuration != null) {
            effective.putAll(configuration);
        }

        SimulationListener listener =
                verbose && !json
                        ? new ConsoleSimulationListener(System.out, color)
                        : SimulationListener.NOOP;
        ExecutionTrace trace = environment.getSimulator().simulate(graph, effective, listener);

        if (json) {
            System.out.println(FlowSerializer.toJson(trace));
            return;
        }
        printSummary(graph, effective, trace);
    }

    private void printSummary(
            FlowGraph graph, Map<String, String> effective, ExecutionTrace trace) {
        AnsiStyles styles = styles();
        System.out.printf(
                "%n%s %s%n",
                styles.successOrError("*", !trace.hasProblems()),
                styles.bold("Simulated " + graph.getMetadata().name()));
        if (!effective.isEmpty()) {
            System.out.println(styles.gray("  Variables: " + effective));
        }

        List<String> path = new ArrayList<>();
        for (String nodeId : trace.visitedNodeIds()) {
            path.add(graph.node(nodeId).map(Node::getLabel).orElse(nodeId));
        }
        System.out.println("  Path: " + String.join(" " + styles.arrow() + " ", path));

        if (trace.completedAt().isEmpty()) {
            System.out.println("  " + styles.warn("No End node reached"));
        } else {
            for (String endId : trace.completedAt()) {
                String label = graph.node(endId).map(Node::getLabel).orElse(endId);
                System.out.println(
                        "  " + styles.checkmark() + " Completed at: " + styles.accent(label));
            }
        }

        for (StepRecord step : trace.steps()) {
            if (step.getLevel() == StepLevel.INFO) {
                continue;
            }
            boolean isError = step.getLevel() == StepLevel.ERROR;
            System.out.printf(
                    "  %s [%s] %s%n",
                    isError ? styles.crossmark() : styles.warnmark(),
                    step.getNodeId(),
                    step.getMessage());
            if (step.getSuggestion() != null) {
                System.out.println("      " + styles.gray(step.getSuggestion()));
            }
        }
        System.out.println(styles.gray("  Steps: " + trace.steps().size()));
    }
}
