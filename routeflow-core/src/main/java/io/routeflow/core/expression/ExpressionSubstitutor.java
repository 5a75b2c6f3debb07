package io.routeflow.core.expression;

import io.routeflow.core.expression.helper.HelperNamespaces;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Produces the display form of an expression by inlining known values.
///
/// Three passes run in order, each over the output of the previous one:
/// 1. `${name}` becomes the configured value of `name`.
/// 2. `session['key']` and `session["key"]` become the configured value of `key`.
/// 3. Bare identifiers bound in the environment or the configuration become their value.
///
/// Values are inlined as source literals, so strings are single-quoted and the result parses
/// back to the same values. Configured values are always strings, even when they look numeric:
/// `'02134'.startsWith('02')` keeps its leading zero, and `==` or `<` against a number still
/// compare numerically. References without a value are left as written. Pass 3 skips
/// keywords, helper namespace names, member names after `.`, object-literal keys and
/// everything inside string or regex literals.
///
/// @implNote Stateless and thread-safe. Substitution never throws; text the lexer rejects is
/// returned after passes 1 and 2 only.
public final class ExpressionSubstitutor {

    private static final Pattern SYSTEM_REF = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern SESSION_REF =
            Pattern.compile("session\\[\\s*(['\"])([^'\"]+)\\1\\s*]");

    /// Runs all three passes.
    ///
    /// @param expression source text, not null
    /// @param environment variables bound by earlier nodes, not null
    /// @param configuration test configuration, not null
    /// @return substituted text, never null
    public String substitute(
            String expression, Map<String, ?> environment, Map<String, String> configuration) {
        String afterSystem = replaceConfigured(SYSTEM_REF, 1, expression, configuration);
        String afterSession = replaceConfigured(SESSION_REF, 2, afterSystem, configuration);
        return replaceIdentifiers(afterSession, merge(environment, configuration));
    }

    /// Merges configuration and environment; environment values win.
    static Map<String, Object> merge(
            Map<String, ?> environment, Map<String, String> configuration) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.putAll(configuration);
        environment.forEach((name, value) -> merged.put(name, Values.normalize(value)));
        return merged;
    }

    private static String replaceConfigured(
            Pattern pattern, int group, String text, Map<String, String> configuration) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(group).trim();
            String replacement =
                    configuration.containsKey(key)
                            ? Values.toSourceLiteral(configuration.get(key))
                            : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String replaceIdentifiers(String text, Map<String, Object> values) {
        List<Token> tokens;
        try {
            tokens = ExpressionLexer.tokenize(text);
        } catch (ExpressionSyntaxException e) {
            return text;
        }
        StringBuilder result = new StringBuilder();
        int copied = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.IDENTIFIER || !replaceable(tokens, i, values)) {
                continue;
            }
            result.append(text, copied, token.start());
            result.append(Values.toSourceLiteral(values.get(token.text())));
            copied = token.end();
        }
        result.append(text.substring(copied));
        return result.toString();
    }

    private static boolean replaceable(List<Token> tokens, int i, Map<String, Object> values) {
        String name = tokens.get(i).text();
        if (!values.containsKey(name)
                || ExpressionParser.isKeyword(name)
                || HelperNamespaces.NAMES.contains(name)) {
            return false;
        }
        Token previous = i > 0 ? tokens.get(i - 1) : null;
        Token following = tokens.get(Math.min(i + 1, tokens.size() - 1));
        if (previous != null && previous.isOperator(".")) {
            return false;
        }
        boolean objectKey =
                previous != null
                        && (previous.isOperator("{") || previous.isOperator(","))
                        && following.isOperator(":");
        boolean assignmentTarget = following.isOperator("=");
        return !objectKey && !assignmentTarget;
    }
}
