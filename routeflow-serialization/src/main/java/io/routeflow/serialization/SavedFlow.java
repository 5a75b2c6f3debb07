package io.routeflow.serialization;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.validation.ValidationResult;
import java.time.Instant;
import java.util.Objects;

/// A graph as stored on disk, with its name, save time and, optionally, the validation result
/// computed when it was saved.
///
/// The file layout is the graph JSON with the extra fields alongside `nodes` and `edges`:
/// `{name, createdAt, version, nodes, edges, sourceDocument?, validation?}`.
///
/// @param name flow name, not null
/// @param createdAt save time, not null
/// @param version file format version, not null
/// @param graph the graph, not null; its metadata name is kept equal to `name`
/// @param validation validation at save time, may be null
public record SavedFlow(
        String name,
        Instant createdAt,
        String version,
        FlowGraph graph,
        ValidationResult validation) {

    public static final String CURRENT_VERSION = "1.0";

    public SavedFlow {
        Objects.requireNonNull(name, "name required");
        Objects.requireNonNull(createdAt, "createdAt required");
        Objects.requireNonNull(version, "version required");
        Objects.requireNonNull(graph, "graph required");
        graph = graph.withMetadata(graph.getMetadata().withName(name));
    }

    /// Creates a saved flow in the current format version.
    public static SavedFlow of(
            String name, FlowGraph graph, ValidationResult validation, Instant createdAt) {
        return new SavedFlow(name, createdAt, CURRENT_VERSION, graph, validation);
    }
}
