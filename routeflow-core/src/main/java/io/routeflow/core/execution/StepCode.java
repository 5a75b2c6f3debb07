package io.routeflow.core.execution;

/// What a trace entry records. The code is stable and used in trace JSON.
public enum StepCode {
    NODE_VISITED("node_visited", StepLevel.INFO),
    VARIABLE_SET("variable_set", StepLevel.INFO),
    CONDITION_EVALUATED("condition_evaluated", StepLevel.INFO),
    FUNCTION_EXECUTED("function_executed", StepLevel.INFO),
    FLOW_COMPLETED("flow_completed", StepLevel.INFO),
    MISSING_TRUE_PATH("missing_true_path", StepLevel.WARNING),
    MISSING_FALSE_PATH("missing_false_path", StepLevel.WARNING),
    CYCLE_DETECTED("cycle_detected", StepLevel.WARNING),
    DANGLING_EDGE("dangling_edge", StepLevel.WARNING),
    STEP_LIMIT_REACHED("step_limit_reached", StepLevel.WARNING),
    CONDITION_ERROR("condition_error", StepLevel.ERROR),
    FUNCTION_ERROR("function_error", StepLevel.ERROR),
    NO_START_NODE("no_start_node", StepLevel.ERROR);

    private final String code;
    private final StepLevel level;

    StepCode(String code, StepLevel level) {
        this.code = code;
        this.level = level;
    }

    public String code() {
        return code;
    }

    /// @return the level entries with this code are recorded at
    public StepLevel level() {
        return level;
    }

    /// Resolves a code string.
    ///
    /// @throws IllegalArgumentException if no constant has that code
    public static StepCode fromCode(String code) {
        for (StepCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown step code: " + code);
    }
}
