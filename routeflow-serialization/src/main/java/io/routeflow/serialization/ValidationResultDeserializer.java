package io.routeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.routeflow.core.validation.IssueKind;
import io.routeflow.core.validation.Severity;
import io.routeflow.core.validation.ValidationIssue;
import io.routeflow.core.validation.ValidationResult;
import io.routeflow.core.validation.ValidationSummary;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Reads the JSON written by {@link ValidationResultSerializer}. `isValid` is recomputed from
/// the errors rather than read back.
class ValidationResultDeserializer extends StdDeserializer<ValidationResult> {

    @Serial private static final long serialVersionUID = 4870215236004851863L;

    ValidationResultDeserializer() {
        super(ValidationResult.class);
    }

    @Override
    public ValidationResult deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        JsonNode summary = root.path("summary");
        return new ValidationResult(
                readIssues(p, root.path("errors")),
                readIssues(p, root.path("warnings")),
                new ValidationSummary(
                        summary.path("nodeCount").asInt(),
                        summary.path("edgeCount").asInt(),
                        summary.path("startCount").asInt(),
                        summary.path("endCount").asInt(),
                        summary.path("reachableCount").asInt()));
    }

    private static List<ValidationIssue> readIssues(JsonParser p, JsonNode array)
            throws JsonMappingException {
        List<ValidationIssue> issues = new ArrayList<>();
        for (JsonNode issue : array) {
            try {
                IssueKind kind = IssueKind.fromCode(issue.path("type").asText());
                String severity = NodeDeserializer.textOrNull(issue, "severity");
                List<String> related = new ArrayList<>();
                for (JsonNode id : issue.path("relatedNodeIds")) {
                    related.add(id.asText());
                }
                issues.add(
                        new ValidationIssue(
                                kind,
                                severity != null
                                        ? Severity.valueOf(severity.toUpperCase(Locale.ROOT))
                                        : kind.severity(),
                                issue.path("message").asText(),
                                NodeDeserializer.textOrNull(issue, "nodeId"),
                                related));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(
                        p, "Invalid validation issue: " + e.getMessage(), e);
            }
        }
        return issues;
    }
}
