package io.routeflow.core.execution;

import io.routeflow.core.graph.node.Position;
import java.util.Map;
import java.util.Objects;

/// One entry of an execution trace.
///
/// ### Contracts
/// - **Precondition**: `nodeId`, `message` and `code` must be provided
/// - **Postcondition**: Immutable after construction; the variables snapshot is a copy taken
///   when the entry was recorded
///
/// @see ExecutionTrace
public final class StepRecord {

    private final String nodeId;
    private final String message;
    private final StepLevel level;
    private final StepCode code;
    private final Map<String, Object> variablesSnapshot;
    private final Position position;
    private final ConditionDetail conditionDetail;
    private final String suggestion;

    private StepRecord(Builder builder) {
        this.nodeId = Objects.requireNonNull(builder.nodeId, "Node ID required");
        this.message = Objects.requireNonNull(builder.message, "Message required");
        this.code = Objects.requireNonNull(builder.code, "Code required");
        this.level = builder.level != null ? builder.level : code.level();
        this.variablesSnapshot =
                builder.variablesSnapshot != null ? builder.variablesSnapshot : Map.of();
        this.position = builder.position;
        this.conditionDetail = builder.conditionDetail;
        this.suggestion = builder.suggestion;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return id of the node the entry is about, or `system` for run-level entries
    public String getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    public StepLevel getLevel() {
        return level;
    }

    public StepCode getCode() {
        return code;
    }

    /// @return variables at the time of recording, never null
    public Map<String, Object> getVariablesSnapshot() {
        return variablesSnapshot;
    }

    /// @return canvas position of the node, or null
    public Position getPosition() {
        return position;
    }

    /// @return condition audit data, or null for non-condition entries
    public ConditionDetail getConditionDetail() {
        return conditionDetail;
    }

    /// @return remediation hint, or null
    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepRecord that)) return false;
        return nodeId.equals(that.nodeId)
                && message.equals(that.message)
                && level == that.level
                && code == that.code
                && variablesSnapshot.equals(that.variablesSnapshot)
                && Objects.equals(position, that.position)
                && Objects.equals(conditionDetail, that.conditionDetail)
                && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, message, level, code, variablesSnapshot);
    }

    @Override
    public String toString() {
        return "StepRecord{" + nodeId + ", " + code.code() + ", '" + message + "'}";
    }

    /// Builder for StepRecord. Level defaults to the code's level.
    public static final class Builder {
        private String nodeId;
        private String message;
        private StepLevel level;
        private StepCode code;
        private Map<String, Object> variablesSnapshot;
        private Position position;
        private ConditionDetail conditionDetail;
        private String suggestion;

        private Builder() {}

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder level(StepLevel level) {
            this.level = level;
            return this;
        }

        public Builder code(StepCode code) {
            this.code = code;
            return this;
        }

        public Builder variablesSnapshot(Map<String, Object> variablesSnapshot) {
            this.variablesSnapshot = variablesSnapshot;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder conditionDetail(ConditionDetail conditionDetail) {
            this.conditionDetail = conditionDetail;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public StepRecord build() {
            return new StepRecord(this);
        }
    }
}
