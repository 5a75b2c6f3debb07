package io.routeflow.serialization.rule;

/// Rule ids derived from flow names for export.
final class RuleIds {

    static final String FALLBACK_ID = "Exported_Workflow";

    private RuleIds() {}

    /// Strips everything but letters, digits and whitespace, joins words with `_`, and trims
    /// leading and trailing underscores. A missing name, or one that reduces to nothing, yields
    /// {@link #FALLBACK_ID}.
    static String fromName(String name) {
        if (name == null) {
            return FALLBACK_ID;
        }
        String id =
                name.replaceAll("[^a-zA-Z0-9\\s]", "")
                        .replaceAll("\\s+", "_")
                        .replaceAll("_{2,}", "_")
                        .replaceAll("^_|_$", "");
        return id.isEmpty() ? FALLBACK_ID : id;
    }
}
