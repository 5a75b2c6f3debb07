package io.routeflow.serialization.rule;

import java.io.Serial;

/// Thrown when a rule document matches none of the supported shapes, or matches a shape but
/// lacks a field that shape requires.
///
/// @see RuleShape#detect(com.fasterxml.jackson.databind.JsonNode)
public class UnsupportedRuleFormatException extends RuntimeException {

    @Serial private static final long serialVersionUID = 7710249365312869930L;

    /// @param message description of what was unsupported, not null
    public UnsupportedRuleFormatException(String message) {
        super(message);
    }

    public UnsupportedRuleFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
