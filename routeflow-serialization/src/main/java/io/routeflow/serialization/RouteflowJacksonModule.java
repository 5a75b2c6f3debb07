package io.routeflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.validation.ValidationResult;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Routeflow type handlers in one place.
///
/// **Serializer/deserializer pairs**:
/// - `Node`: `NodeSerializer` / `NodeDeserializer`, discriminator: `"type"`
/// - `Edge`: `EdgeSerializer` / `EdgeDeserializer`, branch carried as `"sourceHandle"`
/// - `FlowGraph`: `FlowGraphSerializer` / `FlowGraphDeserializer`
/// - `ValidationResult`: `ValidationResultSerializer` / `ValidationResultDeserializer`
/// - `SavedFlow`: `SavedFlowSerializer` / `SavedFlowDeserializer`
///
/// **Write-only**:
/// - `ExecutionTrace`: `ExecutionTraceSerializer`
///
/// @implNote All registrations are explicit. No classpath scanning, no reflection on domain
/// types.
/// @see FlowSerializer for the convenience factory API
public class RouteflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5316022817465190721L;

    /// Constructs the module and registers all serializer/deserializer pairs.
    public RouteflowJacksonModule() {
        super("RouteflowJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(Edge.class, new EdgeSerializer());
        addDeserializer(Edge.class, new EdgeDeserializer());

        addSerializer(FlowGraph.class, new FlowGraphSerializer());
        addDeserializer(FlowGraph.class, new FlowGraphDeserializer());

        addSerializer(ValidationResult.class, new ValidationResultSerializer());
        addDeserializer(ValidationResult.class, new ValidationResultDeserializer());

        addSerializer(SavedFlow.class, new SavedFlowSerializer());
        addDeserializer(SavedFlow.class, new SavedFlowDeserializer());

        addSerializer(ExecutionTrace.class, new ExecutionTraceSerializer());
    }
}
