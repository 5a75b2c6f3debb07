package io.routeflow.core.execution;

import io.routeflow.core.expression.EvaluationScope;
import io.routeflow.core.expression.ExpressionParser;
import io.routeflow.core.expression.Program;
import java.util.Map;

/// Runs Function node bodies.
///
/// Only the current variables are in scope. Helper namespaces are not bound, and the dialect
/// offers arithmetic, string and comparison operators plus object literals, nothing that
/// reaches the host.
///
/// @implNote Stateless and thread-safe.
public final class FunctionBodyEvaluator {

    /// Runs a body.
    ///
    /// @param body statement text, not null
    /// @param variables current variables, not modified
    /// @return the body's result: a record (`Map`), a scalar, or null
    /// @throws io.routeflow.core.expression.ExpressionException on a parse or evaluation failure
    public Object evaluate(String body, Map<String, Object> variables) {
        Program program = ExpressionParser.parseProgram(body);
        return program.execute(EvaluationScope.variablesOnly(variables));
    }
}
