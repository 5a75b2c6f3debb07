package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link SavedFlow} with its graph fields inlined.
class SavedFlowSerializer extends StdSerializer<SavedFlow> {

    @Serial private static final long serialVersionUID = -7396046142558720719L;

    SavedFlowSerializer() {
        super(SavedFlow.class);
    }

    @Override
    public void serialize(SavedFlow flow, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", flow.name());
        gen.writeFieldName("createdAt");
        provider.defaultSerializeValue(flow.createdAt(), gen);
        gen.writeStringField("version", flow.version());
        FlowGraphSerializer.writeGraphFields(flow.graph(), gen);
        if (flow.validation() != null) {
            gen.writeObjectField("validation", flow.validation());
        }
        gen.writeEndObject();
    }
}
