package io.routeflow.core.expression;

import java.io.Serial;

/// Raised when expression text does not conform to the dialect grammar.
public class ExpressionSyntaxException extends ExpressionException {

    @Serial private static final long serialVersionUID = -2265013985531902711L;

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(ErrorKind.SYNTAX, null, message + " at position " + position);
        this.position = position;
    }

    /// @return zero-based character offset of the failure
    public int getPosition() {
        return position;
    }
}
