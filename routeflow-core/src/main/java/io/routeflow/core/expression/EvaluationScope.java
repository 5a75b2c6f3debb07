package io.routeflow.core.expression;

import io.routeflow.core.expression.helper.HelperNamespace;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Name bindings visible to an expression.
///
/// A scope holds exactly two kinds of bindings: variables and helper namespaces. Variables
/// shadow helpers of the same name. Nothing else is reachable, so a name outside both sets
/// raises {@link UnresolvedReferenceException}.
///
/// @implNote Not thread-safe. Create one scope per evaluation; the variable map is copied on
/// construction so writes from a function body never reach the caller's environment.
public final class EvaluationScope {

    private final Map<String, Object> variables;
    private final Map<String, HelperNamespace> helpers;

    private EvaluationScope(Map<String, ?> variables, Map<String, HelperNamespace> helpers) {
        this.variables = new LinkedHashMap<>();
        variables.forEach((name, value) -> this.variables.put(name, Values.normalize(value)));
        this.helpers = helpers;
    }

    /// Creates a scope with variables and helper namespaces.
    public static EvaluationScope of(
            Map<String, ?> variables, Collection<HelperNamespace> helpers) {
        Map<String, HelperNamespace> byName = new LinkedHashMap<>();
        for (HelperNamespace helper : helpers) {
            byName.put(helper.name(), helper);
        }
        return new EvaluationScope(variables, Collections.unmodifiableMap(byName));
    }

    /// Creates a scope with variables only.
    public static EvaluationScope variablesOnly(Map<String, ?> variables) {
        return new EvaluationScope(variables, Map.of());
    }

    /// Resolves a name.
    ///
    /// @throws UnresolvedReferenceException if the name is neither a variable nor a helper
    public Object lookup(String name) {
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        HelperNamespace helper = helpers.get(name);
        if (helper != null) {
            return helper;
        }
        throw UnresolvedReferenceException.variable(name);
    }

    /// Binds a new local, replacing any variable of the same name.
    public void define(String name, Object value) {
        variables.put(name, Values.normalize(value));
    }

    /// Rebinds an existing variable.
    ///
    /// @throws UnresolvedReferenceException if the variable was never bound
    public void assign(String name, Object value) {
        if (!variables.containsKey(name)) {
            throw UnresolvedReferenceException.variable(name);
        }
        variables.put(name, Values.normalize(value));
    }

    /// @return names of the bound variables, in binding order
    public Set<String> variableNames() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    /// @return current variable bindings, unmodifiable view
    public Map<String, Object> variables() {
        return Collections.unmodifiableMap(variables);
    }
}
