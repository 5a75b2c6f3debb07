package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.routeflow.core.execution.ConditionDetail;
import io.routeflow.core.execution.ExecutionTrace;
import io.routeflow.core.execution.StepRecord;
import io.routeflow.core.expression.Values;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Map;

/// Writes a trace as `{steps: [...]}`.
///
/// Each step is `{nodeId, code, level, message, variablesSnapshot, position?, conditionDetail?,
/// suggestion?}`. Whole numbers in snapshots are written without a fraction, so a variable set
/// from `25` reads back as `25`.
class ExecutionTraceSerializer extends StdSerializer<ExecutionTrace> {

    @Serial private static final long serialVersionUID = 1937165002758106243L;

    ExecutionTraceSerializer() {
        super(ExecutionTrace.class);
    }

    @Override
    public void serialize(ExecutionTrace trace, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart("steps");
        for (StepRecord step : trace.steps()) {
            writeStep(gen, step);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeStep(JsonGenerator gen, StepRecord step) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("nodeId", step.getNodeId());
        gen.writeStringField("code", step.getCode().code());
        gen.writeStringField("level", step.getLevel().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("message", step.getMessage());
        gen.writeFieldName("variablesSnapshot");
        writeValue(gen, step.getVariablesSnapshot());
        if (step.getPosition() != null) {
            gen.writeObjectFieldStart("position");
            gen.writeNumberField("x", step.getPosition().x());
            gen.writeNumberField("y", step.getPosition().y());
            gen.writeEndObject();
        }
        ConditionDetail detail = step.getConditionDetail();
        if (detail != null) {
            gen.writeObjectFieldStart("conditionDetail");
            gen.writeStringField("originalExpression", detail.originalExpression());
            gen.writeStringField("substitutedExpression", detail.substitutedExpression());
            if (detail.result() != null) {
                gen.writeBooleanField("result", detail.result());
            } else {
                gen.writeNullField("result");
            }
            gen.writeEndObject();
        }
        if (step.getSuggestion() != null) {
            gen.writeStringField("suggestion", step.getSuggestion());
        }
        gen.writeEndObject();
    }

    private static void writeValue(JsonGenerator gen, Object value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                gen.writeNumber((long) d);
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                gen.writeFieldName(String.valueOf(entry.getKey()));
                writeValue(gen, entry.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeString(Values.toDisplayString(value));
        }
    }
}
