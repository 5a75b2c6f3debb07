package io.routeflow.core.execution;

/// Severity of a trace entry.
public enum StepLevel {
    INFO,
    WARNING,
    ERROR
}
