package io.routeflow.core.expression;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Compiled regular-expression literal (`/source/flags`).
///
/// Supported flags: `i` (case-insensitive), `m` (multi-line), `s` (dot matches newline).
/// `g`, `u` and `y` are accepted and ignored; `test` always searches the whole input.
///
/// @param source pattern text between the slashes
/// @param flags flag letters after the closing slash
/// @param pattern compiled pattern
public record RegexValue(String source, String flags, Pattern pattern) {

    /// Compiles a regex literal.
    ///
    /// @throws ExpressionSyntaxException if the pattern or a flag is invalid
    public static RegexValue compile(String source, String flags, int position) {
        int javaFlags = 0;
        for (char flag : flags.toCharArray()) {
            switch (flag) {
                case 'i' -> javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                case 'm' -> javaFlags |= Pattern.MULTILINE;
                case 's' -> javaFlags |= Pattern.DOTALL;
                case 'g', 'u', 'y' -> {}
                default ->
                        throw new ExpressionSyntaxException(
                                "Invalid regular expression flag '" + flag + "'", position);
            }
        }
        try {
            return new RegexValue(source, flags, Pattern.compile(source, javaFlags));
        } catch (PatternSyntaxException e) {
            throw new ExpressionSyntaxException(
                    "Invalid regular expression /" + source + "/: " + e.getDescription(), position);
        }
    }

    /// Returns whether the pattern occurs anywhere in the input.
    public boolean test(String input) {
        return pattern.matcher(input).find();
    }

    @Override
    public String toString() {
        return "/" + source + "/" + flags;
    }
}
