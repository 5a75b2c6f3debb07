package io.routeflow.cli.commands;

import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.validation.ValidationResult;
import io.routeflow.serialization.FlowSerializer;
import io.routeflow.serialization.SavedFlow;
import io.routeflow.serialization.rule.RuleDocumentConverter;
import io.routeflow.serialization.rule.UnsupportedRuleFormatException;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for importing external rule documents.
///
/// Each rule in the document becomes a saved-flow file `<name>.json` (`Rule1.json`,
/// `Rule2.json`, ...) carrying the validation result computed at import time.
///
/// ### Usage
/// ```bash
/// routeflow import [-d <working-dir>] [-o <output-dir>] <rules.json>
/// ```
///
/// @see RuleDocumentConverter
@Command(name = "import", description = "Import external rule documents as flow files")
class RuleImportCommand extends FlowCommand {

    @Parameters(index = "0", description = "Rule document (one rule object or an array)")
    private String rulesFile;

    @Option(
            names = {"-o", "--output-dir"},
            description = "Directory for the flow files (default: working directory)")
    private Path outputDir;

    @Inject private RuleDocumentConverter converter;

    @Override
    protected void execute() {
        AnsiStyles styles = styles();
        try {
            List<FlowGraph> graphs = converter.importRules(readFile(rulesFile));
            Path target = outputDir != null ? outputDir : getWorkingDirectory();
            Files.createDirectories(target);
            Instant now = Instant.now(environment.getConfig().getClock());

            for (FlowGraph graph : graphs) {
                String name = graph.getMetadata().name();
                ValidationResult validation = environment.getValidator().validate(graph);
                Path file = target.resolve(name + ".json");
                SavedFlow saved = SavedFlow.of(name, graph, validation, now);
                Files.writeString(file, FlowSerializer.toJson(saved));
                System.out.printf(
                        "  %s %s %s %s %s%n",
                        styles.successOrError("*", validation.isValid()),
                        styles.bold(name),
                        styles.arrow(),
                        file,
                        styles.gray("(" + graph.getNodes().size() + " nodes)"));
            }
            System.out.printf(
                    "%n%s %s%n", styles.checkmark(), "Imported " + graphs.size() + " rule(s)");
        } catch (FlowFileException | UnsupportedRuleFormatException | IllegalArgumentException e) {
            System.err.println(" [FAIL] Import failed: " + e.getMessage());
        } catch (IOException e) {
            System.err.println(" [FAIL] Cannot write flow files: " + e.getMessage());
        }
    }
}
