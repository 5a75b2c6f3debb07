package io.routeflow.cli.commands;

import io.routeflow.cli.exception.FlowFileException;
import io.routeflow.cli.ui.AnsiStyles;
import io.routeflow.core.RouteflowEnvironment;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.serialization.FlowSerializer;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for all Routeflow CLI commands.
///
/// Owns the banner, the {@link #run()} / {@link #execute()} contract, working directory
/// resolution and flow file loading. Subclasses implement {@link #execute()}.
///
/// ### Working Directory Resolution
/// Relative file arguments resolve against, in priority order:
/// 1. CLI option `-d` / `--working-dir`
/// 2. Config property `routeflow.working.dir`
/// 3. Current directory (`.`)
///
/// @implNote Subclasses are package-private and annotated with `@Command`.
/// @see FlowValidateCommand
/// @see FlowSimulateCommand
public abstract class FlowCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "                  _         __ _",
        "  _ __ ___  _   _| |_ ___  / _| | _____      __",
        " | '__/ _ \\| | | | __/ _ \\| |_| |/ _ \\ \\ /\\ / /",
        " | | | (_) | |_| | ||  __/|  _| | (_) \\ V  V /",
        " |_|  \\___/ \\__,_|\\__\\___||_| |_|\\___/ \\_/\\_/",
        "",
        " Routing flow validator and simulator",
        ""
    };

    @Option(
            names = {"-d", "--working-dir"},
            description = "Directory that relative file arguments resolve against")
    protected Path workingDirPath;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    protected boolean color = true;

    @Inject
    @ConfigProperty(name = "routeflow.working.dir", defaultValue = ".")
    private String defaultWorkingDir;

    @Inject protected RouteflowEnvironment environment;

    @Override
    public final void run() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Returns whether the banner is printed. Commands writing machine-readable output to
    /// standard out return false.
    protected boolean showBanner() {
        return true;
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(color);
    }

    /// Returns the effective working directory.
    ///
    /// @return absolute directory, never null
    protected Path getWorkingDirectory() {
        Path effectivePath;
        if (workingDirPath != null) {
            effectivePath = workingDirPath;
        } else if (defaultWorkingDir != null && !defaultWorkingDir.isBlank()) {
            effectivePath = Path.of(defaultWorkingDir);
        } else {
            effectivePath = Path.of(".");
        }
        return effectivePath.toAbsolutePath();
    }

    /// Resolves a file argument against the working directory.
    protected Path resolve(String file) {
        Path path = Path.of(file);
        return path.isAbsolute() ? path : getWorkingDirectory().resolve(path);
    }

    /// Reads a file argument as text.
    ///
    /// @throws FlowFileException if the file does not exist or cannot be read
    protected String readFile(String file) throws FlowFileException {
        Path path = resolve(file);
        if (!Files.isRegularFile(path)) {
            throw new FlowFileException("File not found: " + path);
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new FlowFileException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /// Loads a graph JSON or saved-flow file.
    ///
    /// A graph without a name is named after its file, minus the `.json` extension.
    ///
    /// @param file path, absolute or relative to the working directory
    /// @return the graph, never null
    /// @throws FlowFileException if the file is missing or is not valid graph JSON
    protected FlowGraph loadGraph(String file) throws FlowFileException {
        FlowGraph graph;
        try {
            graph = FlowSerializer.graphFromJson(readFile(file));
        } catch (IllegalArgumentException e) {
            throw new FlowFileException("Invalid flow file " + file + ": " + e.getMessage(), e);
        }
        if (graph.getMetadata().name() == null) {
            String fileName = resolve(file).getFileName().toString();
            String name =
                    fileName.endsWith(".json")
                            ? fileName.substring(0, fileName.length() - ".json".length())
                            : fileName;
            graph = graph.withMetadata(graph.getMetadata().withName(name));
        }
        return graph;
    }
}
