package io.routeflow.core.expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Expression AST node.
///
/// The tree is limited to literals, identifiers, operators, member access, calls and object
/// literals. Nothing in it can reach host APIs: every name resolves through an
/// {@link EvaluationScope} and every call dispatches through {@link MemberAccess}.
///
/// @implNote Immutable. One parsed tree may be evaluated against many scopes.
public sealed interface Expr {

    /// Evaluates this node.
    ///
    /// @param scope variable and helper bindings, not null
    /// @return the runtime value, may be null
    /// @throws ExpressionException on an unresolved name or an unsupported operation
    Object evaluate(EvaluationScope scope);

    /// Constant value: number, string, boolean, null or compiled regex.
    record Literal(Object value) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return value;
        }
    }

    /// Bare name, resolved against variables then helper namespaces.
    record Identifier(String name) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return scope.lookup(name);
        }
    }

    /// `${name}` left over after substitution, meaning it had no configured value.
    record SystemRef(String name) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            throw new UnresolvedReferenceException(name, "${" + name + "} is not configured");
        }
    }

    /// `session['key']` left over after substitution.
    record SessionRef(String key) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            throw new UnresolvedReferenceException(
                    key, "session['" + key + "'] is not configured");
        }
    }

    record Unary(String operator, Expr operand) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object value = operand.evaluate(scope);
            return switch (operator) {
                case "!" -> !Values.isTruthy(value);
                case "-" -> -Values.toNumber(value);
                case "+" -> Values.toNumber(value);
                default -> throw new IllegalStateException("Unknown unary operator " + operator);
            };
        }
    }

    record Binary(String operator, Expr left, Expr right) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object l = left.evaluate(scope);
            Object r = right.evaluate(scope);
            return switch (operator) {
                case "+" -> {
                    if (l instanceof String || r instanceof String) {
                        yield Values.toDisplayString(l) + Values.toDisplayString(r);
                    }
                    yield Values.toNumber(l) + Values.toNumber(r);
                }
                case "-" -> Values.toNumber(l) - Values.toNumber(r);
                case "*" -> Values.toNumber(l) * Values.toNumber(r);
                case "/" -> Values.toNumber(l) / Values.toNumber(r);
                case "%" -> Values.toNumber(l) % Values.toNumber(r);
                case "==" -> Values.looseEquals(l, r);
                case "!=" -> !Values.looseEquals(l, r);
                case "===" -> Values.strictEquals(l, r);
                case "!==" -> !Values.strictEquals(l, r);
                case "<", "<=", ">", ">=" -> Values.compare(operator, l, r);
                default -> throw new IllegalStateException("Unknown binary operator " + operator);
            };
        }
    }

    /// `&&` and `||`, short-circuiting and returning the deciding operand.
    record Logical(String operator, Expr left, Expr right) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object l = left.evaluate(scope);
            boolean truthy = Values.isTruthy(l);
            if (operator.equals("&&")) {
                return truthy ? right.evaluate(scope) : l;
            }
            return truthy ? l : right.evaluate(scope);
        }
    }

    record Conditional(Expr test, Expr whenTrue, Expr whenFalse) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return Values.isTruthy(test.evaluate(scope))
                    ? whenTrue.evaluate(scope)
                    : whenFalse.evaluate(scope);
        }
    }

    /// `target.property`.
    record Member(Expr target, String property) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            return MemberAccess.property(target.evaluate(scope), property);
        }
    }

    /// `target[index]`.
    record Index(Expr target, Expr index) implements Expr {
        @Override
        public Object evaluate(EvaluationScope scope) {
            Object value = target.evaluate(scope);
            return MemberAccess.property(value, Values.toDisplayString(index.evaluate(scope)));
        }
    }

    /// Call expression. Only method calls on a receiver are supported.
    record Call(Expr callee, List<Expr> arguments) implements Expr {

        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Object evaluate(EvaluationScope scope) {
            if (callee instanceof Member member) {
                Object receiver = member.target().evaluate(scope);
                return MemberAccess.invoke(receiver, member.property(), evaluateAll(scope));
            }
            Object value = callee.evaluate(scope);
            String name = callee instanceof Identifier id ? id.name() : Values.typeName(value);
            throw ExpressionException.typeError(name, name + " is not a function");
        }

        private List<Object> evaluateAll(EvaluationScope scope) {
            List<Object> values = new ArrayList<>(arguments.size());
            for (Expr argument : arguments) {
                values.add(argument.evaluate(scope));
            }
            return values;
        }
    }

    /// `{ key: value, ... }`, evaluated into an insertion-ordered record.
    record ObjectLiteral(Map<String, Expr> entries) implements Expr {

        public ObjectLiteral {
            entries = new LinkedHashMap<>(entries);
        }

        @Override
        public Object evaluate(EvaluationScope scope) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> entry : entries.entrySet()) {
                record.put(entry.getKey(), entry.getValue().evaluate(scope));
            }
            return record;
        }
    }
}
