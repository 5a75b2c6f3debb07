package io.routeflow.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.serialization.rule.RuleDocumentConverter;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for exporting flows as external rule documents.
///
/// Imported flows export their original rule unchanged. One flow produces a single rule
/// object; several produce an array.
///
/// ### Usage
/// ```bash
/// routeflow export [-d <working-dir>] [-o <rules.json>] <flow.json>...
/// ```
///
/// Without `-o` the document is printed to standard out.
///
/// @see RuleDocumentConverter
@Command(name = "export", description = "Export flows as external rule documents")
class RuleExportCommand extends FlowCommand {

    @Parameters(arity = "1..*", description = "Flow files to export")
    private List<String> flowFiles = new ArrayList<>();

    @Option(
            names = {"-o", "--output"},
            description = "Output file (default: standard out)")
    private Path output;

    @Inject private RuleDocumentConverter converter;

    @Override
    protected boolean showBanner() {
        return output != null;
    }

    @Override
    protected void execute() {
        try {
            List<FlowGraph> graphs = new ArrayList<>();
            for (String file : flowFiles) {
                graphs.add(loadGraph(file));
            }
            JsonNode document =
                    graphs.size() == 1
                            ? converter.exportRule(graphs.get(0))
                            : converter.exportRules(graphs);
            String json = converter.toJson(document);
            if (output == null) {
                System.out.println(json);
                return;
            }
            Path target = resolve(output.toString());
            Files.writeString(target, json);
            System.out.println(
                    styles().checkmark() + " Exported " + graphs.size() + " flow(s) to " + target);
        } catch (FlowFileException | IllegalArgumentException e) {
            System.err.println(" [FAIL] Export failed: " + e.getMessage());
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot write " + output + ": " + e.getMessage());
        }
    }
}
