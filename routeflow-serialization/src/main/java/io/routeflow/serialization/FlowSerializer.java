package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.validation.ValidationResult;

/// Utility class for reading and writing Routeflow documents as JSON.
///
/// ### Usage
/// {@snippet :
/// String json = FlowSerializer.toJson(graph);
/// FlowGraph restored = FlowSerializer.graphFromJson(json);
///
/// SavedFlow saved = SavedFlow.of("Age check", graph, validation, Instant.now());
/// Files.writeString(path, FlowSerializer.toJson(saved));
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see RouteflowJacksonModule for the registered type handlers
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a graph to pretty-printed graph JSON.
    ///
    /// @param graph the graph to serialize, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowGraph graph) {
        return write(graph, "graph");
    }

    /// Serializes a saved flow.
    ///
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(SavedFlow flow) {
        return write(flow, "saved flow");
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ValidationResult result) {
        return write(result, "validation result");
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionTrace trace) {
        return write(trace, "execution trace");
    }

    /// Reads graph JSON. A saved-flow file is accepted too; its extra fields are ignored apart
    /// from `name`.
    ///
    /// @param json JSON text, not null
    /// @return the graph, never null
    /// @throws IllegalArgumentException if the text is not valid graph JSON
    public static FlowGraph graphFromJson(String json) {
        try {
            return createMapper().readValue(json, FlowGraph.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize graph: " + e.getMessage(), e);
        }
    }

    /// Reads a saved-flow file.
    ///
    /// @throws IllegalArgumentException if the text is not a valid saved flow
    public static SavedFlow savedFlowFromJson(String json) {
        try {
            return createMapper().readValue(json, SavedFlow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize saved flow: " + e.getMessage(), e);
        }
    }

    /// Reads a validation result.
    ///
    /// @throws IllegalArgumentException if the text is not a valid validation result
    public static ValidationResult validationFromJson(String json) {
        try {
            return createMapper().readValue(json, ValidationResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize validation result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Routeflow documents.
    ///
    /// Registers:
    /// - `RouteflowJacksonModule` for graphs, saved flows, validation results and traces
    /// - `JavaTimeModule` for the `createdAt` instant of saved flows
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new RouteflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
