package io.routeflow.core.analysis;

import java.util.Locale;

/// Likely type of a test variable, guessed from its name.
public enum DataType {
    DATE,
    NUMBER,
    EMAIL,
    PHONE,
    URL,
    STRING;

    /// Guesses a type from a variable name.
    ///
    /// Names mentioning `date` or `time` are dates; `count`, `number` or `age` are numbers;
    /// `email`, `phone` and `url` map to themselves; everything else is a string.
    public static DataType guess(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("date") || lower.contains("time")) {
            return DATE;
        }
        if (lower.contains("count") || lower.contains("number") || lower.contains("age")) {
            return NUMBER;
        }
        if (lower.contains("email")) {
            return EMAIL;
        }
        if (lower.contains("phone")) {
            return PHONE;
        }
        if (lower.contains("url")) {
            return URL;
        }
        return STRING;
    }
}
