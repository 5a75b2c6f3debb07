package io.routeflow.core.expression;

import io.routeflow.core.expression.helper.HelperNamespaces;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Names an expression refers to, grouped by how they are written.
///
/// @param systemNames names inside `${...}`
/// @param sessionKeys keys inside `session['...']`
/// @param plainNames bare identifiers, excluding keywords, helper namespaces and member names
public record ExpressionReferences(
        Set<String> systemNames, Set<String> sessionKeys, Set<String> plainNames) {

    public ExpressionReferences {
        systemNames = Collections.unmodifiableSet(new LinkedHashSet<>(systemNames));
        sessionKeys = Collections.unmodifiableSet(new LinkedHashSet<>(sessionKeys));
        plainNames = Collections.unmodifiableSet(new LinkedHashSet<>(plainNames));
    }

    /// Collects the references of an expression or function body, in source order.
    ///
    /// Text the lexer rejects yields no references.
    ///
    /// @param source expression text, not null
    /// @return references, never null
    public static ExpressionReferences of(String source) {
        Set<String> system = new LinkedHashSet<>();
        Set<String> session = new LinkedHashSet<>();
        Set<String> plain = new LinkedHashSet<>();
        List<Token> tokens;
        try {
            tokens = ExpressionLexer.tokenize(source);
        } catch (ExpressionSyntaxException e) {
            return new ExpressionReferences(system, session, plain);
        }
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.SYSTEM_REF) {
                system.add(token.text().trim());
                continue;
            }
            if (token.type() != TokenType.IDENTIFIER) {
                continue;
            }
            Token previous = i > 0 ? tokens.get(i - 1) : null;
            if (previous != null && previous.isOperator(".")) {
                continue;
            }
            String name = token.text();
            if (name.equals("session")
                    && i + 3 < tokens.size()
                    && tokens.get(i + 1).isOperator("[")
                    && tokens.get(i + 2).type() == TokenType.STRING
                    && tokens.get(i + 3).isOperator("]")) {
                session.add(tokens.get(i + 2).text());
                i += 3;
                continue;
            }
            if (!ExpressionParser.isKeyword(name) && !HelperNamespaces.NAMES.contains(name)) {
                plain.add(name);
            }
        }
        return new ExpressionReferences(system, session, plain);
    }
}
