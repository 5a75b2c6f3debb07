package io.routeflow.core.expression.helper;

import io.routeflow.core.expression.ErrorKind;
import io.routeflow.core.expression.ExpressionException;
import io.routeflow.core.expression.Values;
import java.util.List;
import java.util.Set;

/// Factory and shared plumbing for the built-in helper namespaces.
public final class HelperNamespaces {

    /// Names of all built-in namespaces. Substitution never replaces these.
    public static final Set<String> NAMES = Set.of("queue", "date", "now", "today");

    private HelperNamespaces() {}

    /// Creates the four standard namespaces bound to a context.
    ///
    /// @param context configuration and clock, not null
    /// @return `queue`, `date`, `now` and `today` namespaces
    public static List<HelperNamespace> standard(HelperContext context) {
        return List.of(
                new QueueHelper(context),
                new DateHelper(context),
                new NowHelper(context),
                new TodayHelper(context));
    }

    static ExpressionException unknownMethod(String namespace, String method) {
        return new ExpressionException(
                ErrorKind.TYPE_ERROR, method, namespace + "." + method + " is not a function");
    }

    static ExpressionException invalidArgument(String namespace, String method, Object value) {
        return new ExpressionException(
                ErrorKind.TYPE_ERROR,
                method,
                namespace + "." + method + " cannot interpret '"
                        + Values.toDisplayString(value) + "'");
    }

    static Object argument(List<Object> arguments, int index, String namespace, String method) {
        if (index >= arguments.size()) {
            throw new ExpressionException(
                    ErrorKind.TYPE_ERROR,
                    method,
                    namespace + "." + method + " requires an argument");
        }
        return arguments.get(index);
    }
}
