package io.routeflow.serialization.rule;

import com.fasterxml.jackson.databind.JsonNode;

/// The three external rule document shapes.
///
/// ```
/// shape             recognized by
/// ──────────────────┼───────────────────────────────
/// ENDPOINT          │ "type": "endpoint"
/// DECISION          │ "type": "decision"
/// EVALUATION_CHAIN  │ "Id" and "Evaluations" present
/// ```
public enum RuleShape {
    ENDPOINT,
    DECISION,
    EVALUATION_CHAIN;

    /// Detects the shape of one rule document.
    ///
    /// @param document a single rule object, not null
    /// @return the shape, never null
    /// @throws UnsupportedRuleFormatException if the document has none of the known shapes
    public static RuleShape detect(JsonNode document) {
        if (document.isObject()) {
            String type = document.path("type").asText("");
            if (type.equals("endpoint")) {
                return ENDPOINT;
            }
            if (type.equals("decision")) {
                return DECISION;
            }
            if (document.hasNonNull("Id") && document.has("Evaluations")) {
                return EVALUATION_CHAIN;
            }
        }
        throw new UnsupportedRuleFormatException(
                "Unsupported workflow format. Expected 'endpoint' or 'decision' type,"
                        + " or a workflow with 'Id' and 'Evaluations'.");
    }
}
