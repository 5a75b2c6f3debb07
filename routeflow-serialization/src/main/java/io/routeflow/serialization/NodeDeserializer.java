package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import io.routeflow.core.graph.node.Position;
import io.routeflow.core.graph.node.StartNode;
import java.io.IOException;
import java.io.Serial;

/// Reads graph JSON nodes using the `"type"` discriminator.
///
/// Accepts the field names written by {@link NodeSerializer}. Input values may be JSON strings
/// or numbers; both are kept as literal text.
///
/// @implNote Package-private. Registered by {@link RouteflowJacksonModule}.
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -6617205493387125064L;

    NodeDeserializer() {
        super(Node.class);
    }

    /// @throws IOException if `id` or `type` is missing, the type is unknown, or a required
    /// payload field is absent
    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        String id = requiredText(p, root, "id");
        NodeType type;
        try {
            type = NodeType.fromTypeName(requiredText(p, root, "type"));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
        JsonNode data = root.has("data") ? root.get("data") : MissingNode.getInstance();
        String label = textOrNull(data, "label");
        Position position = position(root.get("position"));
        try {
            return switch (type) {
                case START ->
                        StartNode.builder()
                                .id(id)
                                .label(label)
                                .position(position)
                                .idLabel(textOrNull(data, "idLabel"))
                                .build();
                case INPUT ->
                        InputNode.builder()
                                .id(id)
                                .label(label)
                                .position(position)
                                .variableName(textOrNull(data, "variable"))
                                .literalValue(textOrNull(data, "value"))
                                .build();
                case CONDITION ->
                        ConditionNode.builder()
                                .id(id)
                                .label(label)
                                .position(position)
                                .expression(textOrNull(data, "condition"))
                                .build();
                case FUNCTION ->
                        FunctionNode.builder()
                                .id(id)
                                .label(label)
                                .position(position)
                                .body(textOrNull(data, "code"))
                                .build();
                case END ->
                        EndNode.builder()
                                .id(id)
                                .label(label)
                                .position(position)
                                .linkTarget(textOrNull(data, "linkTarget"))
                                .build();
            };
        } catch (IllegalStateException e) {
            throw JsonMappingException.from(p, "Invalid node '" + id + "': " + e.getMessage(), e);
        }
    }

    private static Position position(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new Position(node.path("x").asDouble(), node.path("y").asDouble());
    }

    private static String requiredText(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        String value = textOrNull(root, field);
        if (value == null) {
            throw JsonMappingException.from(p, "Node field '" + field + "' is required");
        }
        return value;
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
