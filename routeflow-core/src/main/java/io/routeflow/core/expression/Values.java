package io.routeflow.core.expression;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Value semantics of the expression dialect.
///
/// Runtime values are `null`, `Boolean`, `Double`, `String`, `Map<String, Object>` (records),
/// {@link RegexValue} and {@link io.routeflow.core.expression.helper.HelperNamespace}.
/// Coercions follow the loose rules rule authors expect from browser-style expressions:
/// empty strings and zero are falsy, `==` compares numbers with numeric strings, `===` does not.
public final class Values {

    private Values() {}

    /// Normalizes a host value into the dialect's value domain.
    ///
    /// Every `Number` becomes a `Double`; other values pass through.
    public static Object normalize(Object value) {
        if (value instanceof Number n && !(value instanceof Double)) {
            return n.doubleValue();
        }
        return value;
    }

    /// Returns the truthiness of a value.
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Double d) {
            return d != 0 && !d.isNaN();
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /// Converts a value to a number; unparseable text yields `NaN`.
    public static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /// Strict equality: same type and same value.
    public static boolean strictEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Double l && right instanceof Double r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left.getClass() != right.getClass()) {
            return false;
        }
        if (left instanceof Map || left instanceof RegexValue) {
            return left == right;
        }
        return left.equals(right);
    }

    /// Loose equality: numbers, numeric strings and booleans compare numerically.
    public static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left.getClass() == right.getClass()) {
            return strictEquals(left, right);
        }
        if (isPrimitive(left) && isPrimitive(right)) {
            return toNumber(left) == toNumber(right);
        }
        return false;
    }

    /// Relational comparison. Two strings compare lexicographically, anything else numerically.
    /// Comparisons involving `NaN` are false.
    ///
    /// @param operator one of `<`, `<=`, `>`, `>=`
    public static boolean compare(String operator, Object left, Object right) {
        int order;
        if (left instanceof String l && right instanceof String r) {
            order = l.compareTo(r);
        } else {
            double l = toNumber(left);
            double r = toNumber(right);
            if (Double.isNaN(l) || Double.isNaN(r)) {
                return false;
            }
            order = Double.compare(l, r);
            if (l == r) {
                order = 0;
            }
        }
        return switch (operator) {
            case "<" -> order < 0;
            case "<=" -> order <= 0;
            case ">" -> order > 0;
            case ">=" -> order >= 0;
            default -> throw new IllegalArgumentException("Not a relational operator: " + operator);
        };
    }

    /// Converts a value to its string form, as used by concatenation and string methods.
    public static String toDisplayString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            return formatNumber(d);
        }
        if (value instanceof Map || value instanceof List) {
            return toJson(value);
        }
        return value.toString();
    }

    /// Formats a number without a trailing `.0` for integral values.
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /// Renders a value as source text that parses back to the same value.
    ///
    /// Strings become single-quoted literals; records become object literals.
    public static String toSourceLiteral(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        if (value instanceof Double d) {
            return formatNumber(d);
        }
        return toJson(value);
    }

    /// Renders a value as JSON text.
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        appendJson(sb, value);
        return sb.toString();
    }

    private static void appendJson(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Double d) {
            sb.append(Double.isFinite(d) ? formatNumber(d) : "null");
        } else if (value instanceof Boolean b) {
            sb.append(b);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                appendQuoted(sb, String.valueOf(entry.getKey()));
                sb.append(':');
                appendJson(sb, entry.getValue());
                if (it.hasNext()) {
                    sb.append(',');
                }
            }
            sb.append('}');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendJson(sb, list.get(i));
            }
            sb.append(']');
        } else {
            appendQuoted(sb, value.toString());
        }
    }

    private static void appendQuoted(StringBuilder sb, String text) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    /// Returns a short type name for error messages.
    public static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof RegexValue) {
            return "regex";
        }
        if (value instanceof Map) {
            return "object";
        }
        return Objects.toString(value.getClass().getSimpleName());
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof Double || value instanceof String || value instanceof Boolean;
    }
}
