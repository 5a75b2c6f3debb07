package io.routeflow.core.validation;

/// Kinds of structural issues, each with a fixed severity and a stable code for JSON output.
public enum IssueKind {
    MISSING_START("missing_start", Severity.ERROR),
    MULTIPLE_STARTS("multiple_starts", Severity.WARNING),
    MISSING_END("missing_end", Severity.ERROR),
    DISCONNECTED_START("disconnected_start", Severity.ERROR),
    ORPHANED_END("orphaned_end", Severity.ERROR),
    ORPHANED_NODE("orphaned_node", Severity.ERROR),
    MISSING_TRUE_PATH("missing_true_path", Severity.WARNING),
    MISSING_FALSE_PATH("missing_false_path", Severity.WARNING),
    UNREACHABLE_NODE("unreachable_node", Severity.WARNING),
    DANGLING_EDGE("dangling_edge", Severity.ERROR),
    DUPLICATE_NODE_ID("duplicate_node_id", Severity.ERROR),
    NODE_OVERLAP("node_overlap", Severity.WARNING);

    private final String code;
    private final Severity severity;

    IssueKind(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    /// @return snake_case code such as `missing_start`
    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    /// Resolves a kind from its code.
    ///
    /// @throws IllegalArgumentException if no kind has that code
    public static IssueKind fromCode(String code) {
        for (IssueKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown issue kind: " + code);
    }
}
