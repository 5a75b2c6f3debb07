package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.routeflow.core.validation.ValidationIssue;
import io.routeflow.core.validation.ValidationResult;
import io.routeflow.core.validation.ValidationSummary;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Locale;

/// Writes a validation result as
/// `{isValid, errors: [...], warnings: [...], summary: {...}}`.
///
/// Each issue is `{type, severity, message, nodeId?, relatedNodeIds}` where `type` is the
/// issue kind's snake_case code and `severity` is `"error"` or `"warning"`.
class ValidationResultSerializer extends StdSerializer<ValidationResult> {

    @Serial private static final long serialVersionUID = -2244512993405637750L;

    ValidationResultSerializer() {
        super(ValidationResult.class);
    }

    @Override
    public void serialize(ValidationResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeBooleanField("isValid", result.isValid());
        writeIssues(gen, "errors", result.errors());
        writeIssues(gen, "warnings", result.warnings());
        ValidationSummary summary = result.summary();
        gen.writeObjectFieldStart("summary");
        gen.writeNumberField("nodeCount", summary.nodeCount());
        gen.writeNumberField("edgeCount", summary.edgeCount());
        gen.writeNumberField("startCount", summary.startCount());
        gen.writeNumberField("endCount", summary.endCount());
        gen.writeNumberField("reachableCount", summary.reachableCount());
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private static void writeIssues(JsonGenerator gen, String field, List<ValidationIssue> issues)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (ValidationIssue issue : issues) {
            gen.writeStartObject();
            gen.writeStringField("type", issue.kind().code());
            gen.writeStringField("severity", issue.severity().name().toLowerCase(Locale.ROOT));
            gen.writeStringField("message", issue.message());
            if (issue.nodeId() != null) {
                gen.writeStringField("nodeId", issue.nodeId());
            }
            gen.writeArrayFieldStart("relatedNodeIds");
            for (String related : issue.relatedNodeIds()) {
                gen.writeString(related);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
