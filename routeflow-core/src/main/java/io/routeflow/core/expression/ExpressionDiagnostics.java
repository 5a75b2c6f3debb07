package io.routeflow.core.expression;

import java.util.Collection;
import java.util.TreeSet;

/// Turns expression exceptions into errors with a remediation hint.
public final class ExpressionDiagnostics {

    static final String SYNTAX_HINT =
            "Syntax error. Check for missing quotes around text values or incorrect operators.";
    static final String NULL_ACCESS_HINT =
            "Trying to access property of undefined variable. Check variable names.";

    private ExpressionDiagnostics() {}

    /// Builds the error for a failure.
    ///
    /// @param failure the exception raised by parsing or evaluation, not null
    /// @param available variable names the caller could have referenced; listed sorted
    /// @return error with suggestion, never null
    public static ExpressionError diagnose(
            ExpressionException failure, Collection<String> available) {
        String names = String.join(", ", new TreeSet<>(available));
        if (names.isEmpty()) {
            names = "none";
        }
        String suggestion =
                switch (failure.getKind()) {
                    case UNRESOLVED_REFERENCE ->
                            "Variable \"" + failure.getIdentifier()
                                    + "\" not found. Available variables: " + names;
                    case SYNTAX -> SYNTAX_HINT;
                    case NULL_ACCESS -> NULL_ACCESS_HINT;
                    case TYPE_ERROR -> "Available variables: " + names;
                };
        return new ExpressionError(
                failure.getKind(), failure.getIdentifier(), failure.getMessage(), suggestion);
    }
}
