package io.routeflow.core.expression.helper;

import java.util.List;

/// Fixed set of domain functions pre-bound into every condition scope under {@link #name()}.
///
/// Implementations never consult live services or the system clock directly. Values come from
/// the test configuration or from a {@link HelperContext}, so repeated evaluations agree.
///
/// @see HelperNamespaces#standard(HelperContext)
public interface HelperNamespace {

    /// Returns the name the namespace is bound to, such as `queue`.
    String name();

    /// Invokes a method.
    ///
    /// @param method method name as written after the dot
    /// @param arguments evaluated arguments, never null
    /// @return `Double` or `Boolean` result
    /// @throws io.routeflow.core.expression.ExpressionException if the method does not exist
    Object invoke(String method, List<Object> arguments);
}
