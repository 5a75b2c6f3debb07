package io.routeflow.cli.commands;

import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.validation.ValidationIssue;
import io.routeflow.core.validation.ValidationResult;
import io.routeflow.core.validation.ValidationSummary;
import io.routeflow.serialization.FlowSerializer;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for checking flow structure.
///
/// ### Usage
/// ```bash
/// routeflow validate [-d <working-dir>] [--overlaps] [--json] <flow.json>
/// ```
///
/// ### Options
/// - `--overlaps` - Also report nodes whose canvas boxes overlap, as warnings
/// - `--json` - Print the validation result as JSON instead of text
///
/// @see io.routeflow.core.validation.FlowValidator
@Command(name = "validate", description = "Validate flow structure")
class FlowValidateCommand extends FlowCommand {

    @Parameters(index = "0", description = "Flow file (graph JSON or saved flow)")
    private String flowFile;

    @Option(
            names = {"--overlaps"},
            description = "Also report overlapping nodes")
    private boolean overlaps = false;

    @Option(
            names = {"--json"},
            description = "Print the result as JSON")
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
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return;
        }

        ValidationResult result = environment.getValidator().validate(graph);
        if (overlaps) {
            List<ValidationIssue> warnings = new ArrayList<>(result.warnings());
            warnings.addAll(environment.getOverlapDetector().detect(graph));
            result = new ValidationResult(result.errors(), warnings, result.summary());
        }

        if (json) {
            System.out.println(FlowSerializer.toJson(result));
            return;
        }
        print(graph, result);
    }

    private void print(FlowGraph graph, ValidationResult result) {
        AnsiStyles styles = styles();
        ValidationSummary summary = result.summary();
        if (result.isValid()) {
            System.out.println(" [OK] Flow is valid!");
        } else {
            System.out.println(
                    " [FAIL] Flow has " + result.errors().size() + " error(s)");
        }
        System.out.println("   Name: " + graph.getMetadata().name());
        System.out.printf(
                "   Nodes: %d %s Edges: %d %s Reachable: %d%n",
                summary.nodeCount(),
                styles.bullet(),
                summary.edgeCount(),
                styles.bullet(),
                summary.reachableCount());
        for (ValidationIssue error : result.errors()) {
            System.out.println("   " + styles.crossmark() + " " + describe(styles, error));
        }
        for (ValidationIssue warning : result.warnings()) {
            System.out.println("   " + styles.warnmark() + " " + describe(styles, warning));
        }
    }

    private static String describe(AnsiStyles styles, ValidationIssue issue) {
        return issue.message() + " " + styles.gray("[" + issue.kind().code() + "]");
    }
}
