package io.routeflow.core.expression;

/// Lexical token.
///
/// @param type token category
/// @param text operator text, identifier name, decoded string or system reference name
/// @param start offset of the first character in the source
/// @param end offset one past the last character in the source
record Token(TokenType type, String text, int start, int end) {

    boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    boolean isOperator(String operator) {
        return is(TokenType.OPERATOR, operator);
    }

    String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
