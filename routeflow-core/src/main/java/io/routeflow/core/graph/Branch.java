package io.routeflow.core.graph;

/// Outcome selector on an edge leaving a Condition node.
public enum Branch {
    TRUE,
    FALSE;

    /// Returns the branch serving the given condition outcome.
    public static Branch of(boolean outcome) {
        return outcome ? TRUE : FALSE;
    }

    /// Returns the handle name used in graph JSON (`"true"` / `"false"`).
    public String handle() {
        return this == TRUE ? "true" : "false";
    }

    /// Parses a graph JSON handle.
    ///
    /// @param handle `"true"`, `"false"`, or anything else for an unconditional edge
    /// @return the branch, or null when the handle selects no branch
    public static Branch fromHandle(String handle) {
        if ("true".equalsIgnoreCase(handle)) {
            return TRUE;
        }
        if ("false".equalsIgnoreCase(handle)) {
            return FALSE;
        }
        return null;
    }
}
