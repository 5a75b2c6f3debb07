package io.routeflow.core.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Splits expression text into tokens.
///
/// A `/` starts a regular-expression literal when the previous token cannot end an operand
/// (start of input, an operator other than `)` `]` `}`, or the keyword `return`); otherwise it
/// is the division operator. Line (`//`) and block comments are skipped.
final class ExpressionLexer {

    private static final String[] OPERATORS = {
        "===", "!==", "==", "!=", "<=", ">=", "&&", "||", "<", ">", "!", "+", "-", "*", "/", "%",
        "=", "?", ":", "(", ")", "{", "}", "[", "]", ",", ".", ";"
    };

    private static final Set<String> OPERAND_END = Set.of(")", "]", "}");

    private final String source;
    private int pos;
    private final List<Token> tokens = new ArrayList<>();

    private ExpressionLexer(String source) {
        this.source = source;
    }

    /// Tokenizes the source. The returned list always ends with an EOF token.
    ///
    /// @throws ExpressionSyntaxException on an unterminated literal or unknown character
    static List<Token> tokenize(String source) {
        ExpressionLexer lexer = new ExpressionLexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos, pos));
                return;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c)
                    || (c == '.' && pos + 1 < source.length()
                            && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '\'' || c == '"' || c == '`') {
                readString(c);
            } else if (c == '$' && peek(1) == '{') {
                readSystemRef();
            } else if (Character.isJavaIdentifierStart(c)) {
                readIdentifier();
            } else if (c == '/' && regexAllowed()) {
                readRegex();
            } else {
                readOperator();
            }
        }
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '/' && peek(1) == '*') {
                int close = source.indexOf("*/", pos + 2);
                if (close < 0) {
                    throw new ExpressionSyntaxException("Unterminated comment", pos);
                }
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.get(tokens.size() - 1);
        return switch (previous.type()) {
            case OPERATOR -> !OPERAND_END.contains(previous.text());
            case IDENTIFIER -> previous.text().equals("return");
            default -> false;
        };
    }

    private void readNumber() {
        int start = pos;
        skipDigits();
        // a dot with no digit after it is member access, as in 447700900123.startsWith('44')
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            pos++;
            skipDigits();
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            int mark = pos;
            pos++;
            if (peek(0) == '+' || peek(0) == '-') {
                pos++;
            }
            if (Character.isDigit(peek(0))) {
                skipDigits();
            } else {
                pos = mark;
            }
        }
        String text = source.substring(start, pos);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxException("Invalid number '" + text + "'", start);
        }
        tokens.add(new Token(TokenType.NUMBER, text, start, pos));
    }

    private void skipDigits() {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private void readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder value = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                tokens.add(new Token(TokenType.STRING, value.toString(), start, pos));
                return;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                char escaped = source.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
                pos += 2;
            } else {
                value.append(c);
                pos++;
            }
        }
        throw new ExpressionSyntaxException("Unterminated string literal", start);
    }

    private void readSystemRef() {
        int start = pos;
        int close = source.indexOf('}', pos + 2);
        if (close < 0) {
            throw new ExpressionSyntaxException("Unterminated ${ reference", start);
        }
        pos = close + 1;
        tokens.add(new Token(TokenType.SYSTEM_REF, source.substring(start + 2, close), start, pos));
    }

    private void readIdentifier() {
        int start = pos;
        while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, pos), start, pos));
    }

    private void readRegex() {
        int start = pos;
        pos++;
        boolean inClass = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                pos++;
                while (pos < source.length() && Character.isLetter(source.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(TokenType.REGEX, source.substring(start, pos), start, pos));
                return;
            }
            pos++;
        }
        throw new ExpressionSyntaxException("Unterminated regular expression", start);
    }

    private void readOperator() {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                tokens.add(new Token(TokenType.OPERATOR, operator, pos, pos + operator.length()));
                pos += operator.length();
                return;
            }
        }
        throw new ExpressionSyntaxException(
                "Unexpected character '" + source.charAt(pos) + "'", pos);
    }
}
