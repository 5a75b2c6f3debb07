package io.routeflow.core;

import io.routeflow.core.expression.helper.QueueDefaults;
import java.time.Clock;

/// Configuration options for a Routeflow engine environment.
///
/// ### Default Values
/// - `clock`: system default zone, consulted by the `date`, `now` and `today` helpers when the
///   test configuration does not pin them
/// - `maxSteps`: `1000` node visits per simulation run
/// - `queueDefaults`: AgentStaffed 2, QueueDepth 5, LongestWaitTime 15
///
/// @implNote **Not thread-safe**. Configure before passing to {@link RouteflowFactory} and do
/// not modify afterwards.
///
/// @see RouteflowFactory#createEnvironment(RouteflowConfig)
public class RouteflowConfig {

    public static final int DEFAULT_MAX_STEPS = 1000;

    private Clock clock = Clock.systemDefaultZone();
    private int maxSteps = DEFAULT_MAX_STEPS;
    private QueueDefaults queueDefaults = QueueDefaults.DEFAULT;

    /// Creates a configuration with default values.
    public RouteflowConfig() {}

    public Clock getClock() {
        return clock;
    }

    /// Sets the clock date and time helpers fall back to.
    ///
    /// @param clock clock, not null
    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /// Returns the node-visit budget of one simulation run.
    public int getMaxSteps() {
        return maxSteps;
    }

    /// Sets the node-visit budget of one simulation run.
    ///
    /// @param maxSteps budget, must be positive
    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public QueueDefaults getQueueDefaults() {
        return queueDefaults;
    }

    public void setQueueDefaults(QueueDefaults queueDefaults) {
        this.queueDefaults = queueDefaults;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RouteflowConfig}.
    public static class Builder {
        private final RouteflowConfig config = new RouteflowConfig();

        public Builder clock(Clock clock) {
            config.clock = clock;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            config.maxSteps = maxSteps;
            return this;
        }

        public Builder queueDefaults(QueueDefaults queueDefaults) {
            config.queueDefaults = queueDefaults;
            return this;
        }

        /// @return the configured instance, never null
        public RouteflowConfig build() {
            return config;
        }
    }
}
