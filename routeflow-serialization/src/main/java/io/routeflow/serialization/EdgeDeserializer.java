package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.Edge;
import java.io.IOException;
import java.io.Serial;

/// Reads an edge. A missing id becomes `edge_<source>_<target>`; a `sourceHandle` other than
/// `"true"` or `"false"` makes the edge unconditional.
class EdgeDeserializer extends StdDeserializer<Edge> {

    @Serial private static final long serialVersionUID = -1460912307730955201L;

    EdgeDeserializer() {
        super(Edge.class);
    }

    @Override
    public Edge deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        String source = NodeDeserializer.textOrNull(root, "source");
        String target = NodeDeserializer.textOrNull(root, "target");
        if (source == null || target == null) {
            throw JsonMappingException.from(p, "Edge requires 'source' and 'target'");
        }
        String id = NodeDeserializer.textOrNull(root, "id");
        if (id == null) {
            id = "edge_" + source + "_" + target;
        }
        Branch branch = Branch.fromHandle(NodeDeserializer.textOrNull(root, "sourceHandle"));
        return new Edge(id, source, target, branch);
    }
}
