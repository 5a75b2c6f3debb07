package io.routeflow.core.expression.helper;

/// Fallback values for queue helpers when the configuration supplies none.
///
/// @param agentStaffed value of `queue.AgentStaffed(id)`
/// @param queueDepth value of `queue.QueueDepth(id)`
/// @param longestWaitTime value of `queue.LongestWaitTime(id)`
public record QueueDefaults(double agentStaffed, double queueDepth, double longestWaitTime) {

    public static final QueueDefaults DEFAULT = new QueueDefaults(2, 5, 15);
}
