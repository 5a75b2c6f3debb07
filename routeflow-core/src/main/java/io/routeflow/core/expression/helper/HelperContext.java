package io.routeflow.core.expression.helper;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/// Inputs shared by the helper namespaces of one evaluation.
///
/// @param configuration test configuration, never null
/// @param clock source of the current date and time when the configuration has none
/// @param queueDefaults fallback queue figures
public record HelperContext(
        Map<String, String> configuration, Clock clock, QueueDefaults queueDefaults) {

    public HelperContext {
        configuration = configuration != null ? Map.copyOf(configuration) : Map.of();
        Objects.requireNonNull(clock, "clock required");
        Objects.requireNonNull(queueDefaults, "queueDefaults required");
    }

    /// Returns a configured value.
    ///
    /// @return trimmed value, or null when absent or blank
    public String configured(String key) {
        String value = configuration.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
