package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.GraphMetadata;
import io.routeflow.core.graph.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Reads graph JSON into a `FlowGraph`.
///
/// Unknown top-level fields are ignored, so a saved-flow file reads as its graph. Missing
/// `nodes` or `edges` arrays read as empty.
///
/// @implNote Package-private. Registered by {@link RouteflowJacksonModule}.
class FlowGraphDeserializer extends StdDeserializer<FlowGraph> {

    @Serial private static final long serialVersionUID = -3528730541903177260L;

    FlowGraphDeserializer() {
        super(FlowGraph.class);
    }

    @Override
    public FlowGraph deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return readGraph(p, mapper, root, NodeDeserializer.textOrNull(root, "name"));
    }

    /// Builds a graph from the `nodes`, `edges` and `sourceDocument` fields of `root`.
    static FlowGraph readGraph(JsonParser p, ObjectMapper mapper, JsonNode root, String name)
            throws IOException {
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Graph JSON must be an object");
        }
        FlowGraph.Builder builder = FlowGraph.builder();
        for (JsonNode node : root.path("nodes")) {
            builder.node(mapper.treeToValue(node, Node.class));
        }
        for (JsonNode edge : root.path("edges")) {
            builder.edge(mapper.treeToValue(edge, Edge.class));
        }
        JsonNode document = root.get("sourceDocument");
        String sourceDocument =
                document == null || document.isNull()
                        ? null
                        : document.isTextual() ? document.asText() : document.toString();
        return builder.metadata(new GraphMetadata(name, sourceDocument)).build();
    }
}
