package io.routeflow.core.expression;

import java.io.Serial;

/// Raised when an expression or function body cannot be parsed or evaluated.
///
/// Carries the failure category and, where one exists, the identifier that caused it so a
/// caller can build a targeted suggestion.
///
/// @see ExpressionDiagnostics for turning an exception into user-facing feedback
public class ExpressionException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4183716500283512934L;

    private final ErrorKind kind;
    private final String identifier;

    public ExpressionException(ErrorKind kind, String identifier, String message) {
        super(message);
        this.kind = kind;
        this.identifier = identifier;
    }

    /// @return failure category, never null
    public ErrorKind getKind() {
        return kind;
    }

    /// @return offending identifier, or null if the failure is not tied to one
    public String getIdentifier() {
        return identifier;
    }

    static ExpressionException nullAccess(String property) {
        return new ExpressionException(
                ErrorKind.NULL_ACCESS,
                property,
                "Cannot read property '" + property + "' of null");
    }

    static ExpressionException typeError(String identifier, String message) {
        return new ExpressionException(ErrorKind.TYPE_ERROR, identifier, message);
    }
}
