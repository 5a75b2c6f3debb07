package io.routeflow.core.expression;

import java.util.List;

/// Parsed function body: a sequence of statements.
///
/// Execution stops at the first `return`. Without one, the value of the last bare expression
/// statement is the result, so a body such as `price * quantity` needs no `return` keyword.
///
/// @param statements statements in source order
public record Program(List<Statement> statements) {

    public Program {
        statements = List.copyOf(statements);
    }

    /// Runs the statements against a scope. Declarations and assignments write into the scope.
    ///
    /// @param scope bindings, not null
    /// @return the returned value, may be null
    /// @throws ExpressionException on any evaluation failure
    public Object execute(EvaluationScope scope) {
        Object last = null;
        for (Statement statement : statements) {
            if (statement instanceof Statement.Return ret) {
                return ret.value() != null ? ret.value().evaluate(scope) : null;
            }
            if (statement instanceof Statement.Declare declare) {
                scope.define(declare.name(), declare.value().evaluate(scope));
                last = null;
            } else if (statement instanceof Statement.Assign assign) {
                last = assign.value().evaluate(scope);
                scope.assign(assign.name(), last);
            } else if (statement instanceof Statement.Evaluate evaluate) {
                last = evaluate.value().evaluate(scope);
            }
        }
        return last;
    }
}
