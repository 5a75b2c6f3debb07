package io.routeflow.core.execution;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Ordered entries produced by one simulation run.
///
/// @param steps entries in recording order
public record ExecutionTrace(List<StepRecord> steps) {

    public ExecutionTrace {
        steps = List.copyOf(steps);
    }

    /// Returns node ids in visiting order, one per visit.
    public List<String> visitedNodeIds() {
        List<String> visited = new ArrayList<>();
        for (StepRecord step : steps) {
            if (step.getCode() == StepCode.NODE_VISITED) {
                visited.add(step.getNodeId());
            }
        }
        return visited;
    }

    /// Returns whether a node was visited at least once.
    public boolean visited(String nodeId) {
        return visitedNodeIds().contains(nodeId);
    }

    /// Returns the entries with the given code.
    public List<StepRecord> stepsWithCode(StepCode code) {
        List<StepRecord> matches = new ArrayList<>();
        for (StepRecord step : steps) {
            if (step.getCode() == code) {
                matches.add(step);
            }
        }
        return matches;
    }

    /// Returns whether any entry is a warning or an error.
    public boolean hasProblems() {
        for (StepRecord step : steps) {
            if (step.getLevel() != StepLevel.INFO) {
                return true;
            }
        }
        return false;
    }

    /// Returns the distinct End nodes reached, in first-reached order.
    public Set<String> completedAt() {
        Set<String> ends = new LinkedHashSet<>();
        for (StepRecord step : stepsWithCode(StepCode.FLOW_COMPLETED)) {
            ends.add(step.getNodeId());
        }
        return ends;
    }
}
