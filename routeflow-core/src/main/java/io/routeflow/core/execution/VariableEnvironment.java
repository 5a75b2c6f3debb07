package io.routeflow.core.execution;

import io.routeflow.core.expression.Values;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Variables bound during one simulation path.
///
/// Values are numbers (`Double`), strings, booleans or records (`Map`). Each branch of a
/// condition works on its own {@link #copy()}, so bindings made on one path never leak into
/// another.
///
/// @implNote Not thread-safe. Owned by a single walk.
public final class VariableEnvironment {

    private final Map<String, Object> values;

    public VariableEnvironment() {
        this.values = new LinkedHashMap<>();
    }

    private VariableEnvironment(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /// Binds or rebinds a variable.
    public void bind(String name, Object value) {
        values.put(name, Values.normalize(value));
    }

    /// Binds every entry of a record.
    public void merge(Map<?, ?> record) {
        record.forEach((name, value) -> bind(String.valueOf(name), value));
    }

    /// @return live read-only view of the bindings
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /// @return independent copy of the current bindings, in binding order
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public VariableEnvironment copy() {
        return new VariableEnvironment(values);
    }
}
