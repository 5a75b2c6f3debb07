package io.routeflow.core.execution;

/// Observer of a simulation run.
///
/// All methods have no-op defaults so a listener overrides only what it needs.
///
/// ```
/// onStep(record)      once per trace entry, in trace order
/// onComplete(trace)   once, after the walk ends
/// ```
///
/// @see FlowSimulator
public interface SimulationListener {

    /// Called when an entry is appended to the trace.
    ///
    /// @param step the new entry, not null
    default void onStep(StepRecord step) {}

    /// Called when the run is over.
    ///
    /// @param trace the complete trace, not null
    default void onComplete(ExecutionTrace trace) {}

    /// Listener that ignores all events.
    SimulationListener NOOP = new SimulationListener() {};
}
