package io.routeflow.core.validation;

/// Whether an issue blocks validity.
public enum Severity {
    ERROR,
    WARNING
}
