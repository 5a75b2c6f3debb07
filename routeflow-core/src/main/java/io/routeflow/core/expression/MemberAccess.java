package io.routeflow.core.expression;

import io.routeflow.core.expression.helper.HelperNamespace;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Property reads and method dispatch for the values an expression can hold.
final class MemberAccess {

    private MemberAccess() {}

    static Object property(Object target, String name) {
        if (target == null) {
            throw ExpressionException.nullAccess(name);
        }
        if (target instanceof String s) {
            if (name.equals("length")) {
                return (double) s.length();
            }
            return null;
        }
        if (target instanceof Map<?, ?> record) {
            return record.get(name);
        }
        if (target instanceof RegexValue regex) {
            return switch (name) {
                case "source" -> regex.source();
                case "flags" -> regex.flags();
                default -> null;
            };
        }
        return null;
    }

    static Object invoke(Object receiver, String method, List<Object> args) {
        if (receiver == null) {
            throw ExpressionException.nullAccess(method);
        }
        if (receiver instanceof HelperNamespace helper) {
            return helper.invoke(method, args);
        }
        if (receiver instanceof String s) {
            return invokeString(s, method, args);
        }
        if (receiver instanceof RegexValue regex && method.equals("test")) {
            return regex.test(Values.toDisplayString(arg(args, 0)));
        }
        throw ExpressionException.typeError(
                method, Values.typeName(receiver) + "." + method + " is not a function");
    }

    private static Object invokeString(String s, String method, List<Object> args) {
        return switch (method) {
            case "includes" -> s.contains(Values.toDisplayString(arg(args, 0)));
            case "startsWith" -> s.startsWith(Values.toDisplayString(arg(args, 0)));
            case "endsWith" -> s.endsWith(Values.toDisplayString(arg(args, 0)));
            case "toLowerCase" -> s.toLowerCase(Locale.ROOT);
            case "toUpperCase" -> s.toUpperCase(Locale.ROOT);
            case "trim" -> s.trim();
            case "indexOf" -> (double) s.indexOf(Values.toDisplayString(arg(args, 0)));
            default ->
                    throw ExpressionException.typeError(
                            method, "string." + method + " is not a function");
        };
    }

    private static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : "undefined";
    }
}
