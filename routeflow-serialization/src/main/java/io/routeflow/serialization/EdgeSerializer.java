package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.routeflow.core.graph.Edge;
import java.io.IOException;
import java.io.Serial;

/// Writes an edge as `{id, source, target, sourceHandle?}`; the handle is the branch name.
class EdgeSerializer extends StdSerializer<Edge> {

    @Serial private static final long serialVersionUID = 8207462019736605412L;

    EdgeSerializer() {
        super(Edge.class);
    }

    @Override
    public void serialize(Edge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        if (edge.branch() != null) {
            gen.writeStringField("sourceHandle", edge.branch().handle());
        }
        gen.writeEndObject();
    }
}
