package io.routeflow.core.validation;

/// Graph counts reported with every validation, valid or not.
///
/// @param nodeCount number of nodes
/// @param edgeCount number of edges
/// @param startCount number of Start nodes
/// @param endCount number of End nodes
/// @param reachableCount nodes that are Start nodes or reachable from one
public record ValidationSummary(
        int nodeCount, int edgeCount, int startCount, int endCount, int reachableCount) {}
