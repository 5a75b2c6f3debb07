package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.GraphMetadata;
import io.routeflow.core.graph.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `FlowGraph` to graph JSON.
///
/// Output shape: `{name?, nodes: [...], edges: [...], sourceDocument?}`. The source document of
/// an imported graph is embedded as a JSON value, not as an escaped string.
///
/// @implNote Package-private. Registered by {@link RouteflowJacksonModule}.
/// @see FlowGraphDeserializer for the inverse operation
class FlowGraphSerializer extends StdSerializer<FlowGraph> {

    @Serial private static final long serialVersionUID = 6179304622173590447L;

    private static final ObjectMapper DOCUMENT_READER = new ObjectMapper();

    FlowGraphSerializer() {
        super(FlowGraph.class);
    }

    @Override
    public void serialize(FlowGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (graph.getMetadata().name() != null) {
            gen.writeStringField("name", graph.getMetadata().name());
        }
        writeGraphFields(graph, gen);
        gen.writeEndObject();
    }

    /// Writes `nodes`, `edges` and `sourceDocument` into an already opened object.
    static void writeGraphFields(FlowGraph graph, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart("nodes");
        for (Node node : graph.getNodes()) {
            gen.writeObject(node);
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("edges");
        for (Edge edge : graph.getEdges()) {
            gen.writeObject(edge);
        }
        gen.writeEndArray();
        GraphMetadata metadata = graph.getMetadata();
        if (metadata.isImported()) {
            gen.writeFieldName("sourceDocument");
            gen.writeTree(DOCUMENT_READER.readTree(metadata.sourceDocument()));
        }
    }
}
