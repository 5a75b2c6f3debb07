package io.routeflow.core.expression;

/// Statement of a function body.
public sealed interface Statement {

    /// `let|const|var name = value;`, binding a new local.
    record Declare(String name, Expr value) implements Statement {}

    /// `name = value;`, rebinding an existing variable.
    record Assign(String name, Expr value) implements Statement {}

    /// `return value;`.
    record Return(Expr value) implements Statement {}

    /// Bare expression evaluated for its value.
    record Evaluate(Expr value) implements Statement {}
}
