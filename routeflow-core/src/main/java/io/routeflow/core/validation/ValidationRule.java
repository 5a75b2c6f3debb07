package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import java.util.List;

/// One structural check.
///
/// Rules are independent: none sees another's findings, and each reports every violation it
/// finds instead of stopping at the first.
@FunctionalInterface
public interface ValidationRule {

    /// Checks a graph.
    ///
    /// @param graph graph to inspect, not null
    /// @return issues found, never null (empty when the graph passes)
    List<ValidationIssue> check(FlowGraph graph);
}
