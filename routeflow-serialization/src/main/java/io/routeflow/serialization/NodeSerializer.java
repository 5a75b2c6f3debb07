package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.EndNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.StartNode;
import java.io.IOException;
import java.io.Serial;

/// Serializes `Node` subtypes to graph JSON with a `"type"` discriminator.
///
/// Every object has `id`, `type`, an optional `position` and a `data` object holding the label
/// and the kind-specific fields:
///
/// ```
/// type        data fields
/// ────────────┼──────────────────────────
/// start       │ label, idLabel?
/// input       │ label, variable, value
/// condition   │ label, condition
/// function    │ label, code
/// end         │ label, linkTarget?
/// ```
///
/// @implNote Package-private. Registered by {@link RouteflowJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 3052913376410512889L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("type", node.getNodeType().typeName());
        if (node.getPosition() != null) {
            gen.writeObjectFieldStart("position");
            gen.writeNumberField("x", node.getPosition().x());
            gen.writeNumberField("y", node.getPosition().y());
            gen.writeEndObject();
        }
        gen.writeObjectFieldStart("data");
        gen.writeStringField("label", node.getLabel());
        if (node instanceof StartNode start) {
            writeIfNotNull(gen, "idLabel", start.getIdLabel());
        } else if (node instanceof InputNode input) {
            gen.writeStringField("variable", input.getVariableName());
            gen.writeStringField("value", input.getLiteralValue());
        } else if (node instanceof ConditionNode condition) {
            gen.writeStringField("condition", condition.getExpression());
        } else if (node instanceof FunctionNode function) {
            gen.writeStringField("code", function.getBody());
        } else if (node instanceof EndNode end) {
            writeIfNotNull(gen, "linkTarget", end.getLinkTarget().orElse(null));
        } else {
            throw new IOException("Unknown node type: " + node.getClass().getSimpleName());
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
