package io.routeflow.core.validation;

import java.util.List;
import java.util.Objects;

/// One structural finding.
///
/// @param kind what was found, not null
/// @param severity blocking level, always `kind.severity()` for issues built by the factories
/// @param message human-readable description, not null
/// @param nodeId node the issue is about, or null for graph-wide issues
/// @param relatedNodeIds other nodes involved, such as every Start node for `multiple_starts`
public record ValidationIssue(
        IssueKind kind,
        Severity severity,
        String message,
        String nodeId,
        List<String> relatedNodeIds) {

    public ValidationIssue {
        Objects.requireNonNull(kind, "kind required");
        Objects.requireNonNull(severity, "severity required");
        Objects.requireNonNull(message, "message required");
        relatedNodeIds = relatedNodeIds != null ? List.copyOf(relatedNodeIds) : List.of();
    }

    /// Creates a graph-wide issue.
    public static ValidationIssue of(IssueKind kind, String message) {
        return new ValidationIssue(kind, kind.severity(), message, null, List.of());
    }

    /// Creates an issue about one node.
    public static ValidationIssue forNode(IssueKind kind, String message, String nodeId) {
        return new ValidationIssue(kind, kind.severity(), message, nodeId, List.of());
    }

    /// Creates an issue involving several nodes.
    public static ValidationIssue forNodes(IssueKind kind, String message, List<String> nodeIds) {
        return new ValidationIssue(kind, kind.severity(), message, null, nodeIds);
    }
}
