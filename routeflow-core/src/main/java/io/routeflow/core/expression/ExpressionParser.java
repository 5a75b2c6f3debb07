package io.routeflow.core.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Recursive-descent parser for condition expressions and function bodies.
///
/// ### Grammar
/// ```
/// program     := statement* EOF
/// statement   := ("let" | "const" | "var") IDENT "=" expression ";"?
///              | "return" expression? ";"?
///              | IDENT "=" expression ";"?
///              | expression ";"?
/// expression  := logicalOr ("?" expression ":" expression)?
/// logicalOr   := logicalAnd ("||" logicalAnd)*
/// logicalAnd  := equality ("&&" equality)*
/// equality    := relational (("==" | "!=" | "===" | "!==") relational)*
/// relational  := additive (("<" | "<=" | ">" | ">=") additive)*
/// additive    := multiplicative (("+" | "-") multiplicative)*
/// multiplicative := unary (("*" | "/" | "%") unary)*
/// unary       := ("!" | "-" | "+") unary | postfix
/// postfix     := primary ("." IDENT | "[" expression "]" | "(" arguments ")")*
/// primary     := NUMBER | STRING | REGEX | "${" name "}" | "session[" STRING "]"
///              | "true" | "false" | "null" | "undefined" | "NaN" | "Infinity" | IDENT
///              | "(" expression ")" | "{" (key ":" expression ("," key ":" expression)*)? ","? "}"
/// ```
///
/// @implNote Stateless; every call builds its own token cursor.
public final class ExpressionParser {

    private static final Set<String> KEYWORDS =
            Set.of("let", "const", "var", "return", "true", "false", "null", "undefined");

    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.tokens = ExpressionLexer.tokenize(source);
    }

    /// Parses a single condition expression. A trailing `;` is tolerated.
    ///
    /// @param source expression text, not null
    /// @return the expression tree, never null
    /// @throws ExpressionSyntaxException if the text is empty or malformed
    public static Expr parseExpression(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        if (parser.peek().type() == TokenType.EOF) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        Expr expr = parser.expression();
        parser.acceptOperator(";");
        parser.expectEnd();
        return expr;
    }

    /// Parses a function body.
    ///
    /// @param source statement text, not null
    /// @return the program, never null (empty for blank input)
    /// @throws ExpressionSyntaxException if the text is malformed
    public static Program parseProgram(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        List<Statement> statements = new ArrayList<>();
        while (parser.peek().type() != TokenType.EOF) {
            statements.add(parser.statement());
        }
        return new Program(statements);
    }

    /// Returns whether a name is reserved by the dialect.
    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    // --- Statements ---

    private Statement statement() {
        Token token = peek();
        Statement statement;
        if (token.type() == TokenType.IDENTIFIER
                && (token.text().equals("let")
                        || token.text().equals("const")
                        || token.text().equals("var"))) {
            next();
            String name = expectIdentifier();
            expectOperator("=");
            statement = new Statement.Declare(name, expression());
        } else if (token.is(TokenType.IDENTIFIER, "return")) {
            next();
            Expr value = atStatementEnd() ? null : expression();
            statement = new Statement.Return(value);
        } else if (token.type() == TokenType.IDENTIFIER
                && !isKeyword(token.text())
                && peekAhead(1).isOperator("=")) {
            next();
            next();
            statement = new Statement.Assign(token.text(), expression());
        } else {
            statement = new Statement.Evaluate(expression());
        }
        while (acceptOperator(";")) {
            // consecutive separators are allowed
        }
        return statement;
    }

    private boolean atStatementEnd() {
        Token token = peek();
        return token.type() == TokenType.EOF || token.isOperator(";") || token.isOperator("}");
    }

    // --- Expressions, lowest precedence first ---

    private Expr expression() {
        Expr test = logicalOr();
        if (acceptOperator("?")) {
            Expr whenTrue = expression();
            expectOperator(":");
            Expr whenFalse = expression();
            return new Expr.Conditional(test, whenTrue, whenFalse);
        }
        return test;
    }

    private Expr logicalOr() {
        Expr left = logicalAnd();
        while (acceptOperator("||")) {
            left = new Expr.Logical("||", left, logicalAnd());
        }
        return left;
    }

    private Expr logicalAnd() {
        Expr left = equality();
        while (acceptOperator("&&")) {
            left = new Expr.Logical("&&", left, equality());
        }
        return left;
    }

    private Expr equality() {
        Expr left = relational();
        while (true) {
            String operator = acceptAnyOperator("===", "!==", "==", "!=");
            if (operator == null) {
                return left;
            }
            left = new Expr.Binary(operator, left, relational());
        }
    }

    private Expr relational() {
        Expr left = additive();
        while (true) {
            String operator = acceptAnyOperator("<=", ">=", "<", ">");
            if (operator == null) {
                return left;
            }
            left = new Expr.Binary(operator, left, additive());
        }
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (true) {
            String operator = acceptAnyOperator("+", "-");
            if (operator == null) {
                return left;
            }
            left = new Expr.Binary(operator, left, multiplicative());
        }
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (true) {
            String operator = acceptAnyOperator("*", "/", "%");
            if (operator == null) {
                return left;
            }
            left = new Expr.Binary(operator, left, unary());
        }
    }

    private Expr unary() {
        String operator = acceptAnyOperator("!", "-", "+");
        if (operator != null) {
            return new Expr.Unary(operator, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (acceptOperator(".")) {
                expr = new Expr.Member(expr, expectIdentifier());
            } else if (acceptOperator("[")) {
                Expr indexExpr = expression();
                expectOperator("]");
                expr = new Expr.Index(expr, indexExpr);
            } else if (acceptOperator("(")) {
                expr = new Expr.Call(expr, arguments());
            } else {
                return expr;
            }
        }
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (acceptOperator(")")) {
            return args;
        }
        do {
            args.add(expression());
        } while (acceptOperator(","));
        expectOperator(")");
        return args;
    }

    private Expr primary() {
        Token token = next();
        switch (token.type()) {
            case NUMBER:
                return new Expr.Literal(Double.parseDouble(token.text()));
            case STRING:
                return new Expr.Literal(token.text());
            case REGEX:
                return regex(token);
            case SYSTEM_REF:
                return new Expr.SystemRef(token.text().trim());
            case IDENTIFIER:
                return identifier(token);
            case OPERATOR:
                if (token.isOperator("(")) {
                    Expr inner = expression();
                    expectOperator(")");
                    return inner;
                }
                if (token.isOperator("{")) {
                    return objectLiteral();
                }
                break;
            default:
                break;
        }
        throw new ExpressionSyntaxException("Unexpected " + token.describe(), token.start());
    }

    private Expr identifier(Token token) {
        switch (token.text()) {
            case "true":
                return new Expr.Literal(Boolean.TRUE);
            case "false":
                return new Expr.Literal(Boolean.FALSE);
            case "null":
            case "undefined":
                return new Expr.Literal(null);
            case "NaN":
                return new Expr.Literal(Double.NaN);
            case "Infinity":
                return new Expr.Literal(Double.POSITIVE_INFINITY);
            case "let":
            case "const":
            case "var":
            case "return":
                throw new ExpressionSyntaxException(
                        "Unexpected keyword '" + token.text() + "'", token.start());
            default:
                break;
        }
        if (token.text().equals("session")
                && peek().isOperator("[")
                && peekAhead(1).type() == TokenType.STRING
                && peekAhead(2).isOperator("]")) {
            next();
            String key = next().text();
            next();
            return new Expr.SessionRef(key);
        }
        return new Expr.Identifier(token.text());
    }

    private Expr regex(Token token) {
        String text = token.text();
        int close = text.lastIndexOf('/');
        String pattern = text.substring(1, close);
        String flags = text.substring(close + 1);
        return new Expr.Literal(RegexValue.compile(pattern, flags, token.start()));
    }

    private Expr objectLiteral() {
        Map<String, Expr> entries = new LinkedHashMap<>();
        while (!acceptOperator("}")) {
            Token key = next();
            if (key.type() != TokenType.IDENTIFIER
                    && key.type() != TokenType.STRING
                    && key.type() != TokenType.NUMBER) {
                throw new ExpressionSyntaxException(
                        "Expected property name but found " + key.describe(), key.start());
            }
            expectOperator(":");
            entries.put(key.text(), expression());
            if (!acceptOperator(",")) {
                expectOperator("}");
                break;
            }
        }
        return new Expr.ObjectLiteral(entries);
    }

    // --- Token cursor ---

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private boolean acceptOperator(String operator) {
        if (peek().isOperator(operator)) {
            index++;
            return true;
        }
        return false;
    }

    private String acceptAnyOperator(String... operators) {
        for (String operator : operators) {
            if (acceptOperator(operator)) {
                return operator;
            }
        }
        return null;
    }

    private void expectOperator(String operator) {
        Token token = peek();
        if (!acceptOperator(operator)) {
            throw new ExpressionSyntaxException(
                    "Expected '" + operator + "' but found " + token.describe(), token.start());
        }
    }

    private String expectIdentifier() {
        Token token = next();
        if (token.type() != TokenType.IDENTIFIER || isKeyword(token.text())) {
            throw new ExpressionSyntaxException(
                    "Expected identifier but found " + token.describe(), token.start());
        }
        return token.text();
    }

    private void expectEnd() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            throw new ExpressionSyntaxException("Unexpected " + token.describe(), token.start());
        }
    }
}
