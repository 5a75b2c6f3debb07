package io.routeflow.core.expression;

import java.io.Serial;

/// Raised when an expression references a name that is neither a bound variable nor a helper
/// namespace, or a `${...}` / `session[...]` reference with no configured value.
public class UnresolvedReferenceException extends ExpressionException {

    @Serial private static final long serialVersionUID = 7391532048812730255L;

    public UnresolvedReferenceException(String identifier, String message) {
        super(ErrorKind.UNRESOLVED_REFERENCE, identifier, message);
    }

    /// Creates the exception for an unbound plain identifier.
    public static UnresolvedReferenceException variable(String identifier) {
        return new UnresolvedReferenceException(identifier, identifier + " is not defined");
    }
}
