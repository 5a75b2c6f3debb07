package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.validation.ValidationResult;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;

/// Reads a saved-flow file. A missing `version` reads as {@link SavedFlow#CURRENT_VERSION}.
class SavedFlowDeserializer extends StdDeserializer<SavedFlow> {

    @Serial private static final long serialVersionUID = 2685540061348205514L;

    SavedFlowDeserializer() {
        super(SavedFlow.class);
    }

    /// @throws IOException if `name` or `createdAt` is missing or malformed
    @Override
    public SavedFlow deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        String name = NodeDeserializer.textOrNull(root, "name");
        if (name == null) {
            throw JsonMappingException.from(p, "Saved flow field 'name' is required");
        }
        JsonNode createdAtNode = root.get("createdAt");
        if (createdAtNode == null || createdAtNode.isNull()) {
            throw JsonMappingException.from(p, "Saved flow field 'createdAt' is required");
        }
        Instant createdAt = mapper.treeToValue(createdAtNode, Instant.class);
        String version = NodeDeserializer.textOrNull(root, "version");
        FlowGraph graph = FlowGraphDeserializer.readGraph(p, mapper, root, name);
        JsonNode validationNode = root.get("validation");
        ValidationResult validation =
                validationNode == null || validationNode.isNull()
                        ? null
                        : mapper.treeToValue(validationNode, ValidationResult.class);
        return new SavedFlow(
                name,
                createdAt,
                version != null ? version : SavedFlow.CURRENT_VERSION,
                graph,
                validation);
    }
}
