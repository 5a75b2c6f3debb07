package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Classifies a graph as structurally runnable.
///
/// ### Rules
/// | Code | Severity |
/// |------|----------|
/// | `missing_start` | error |
/// | `multiple_starts` | warning |
/// | `missing_end` | error |
/// | `disconnected_start` | error |
/// | `orphaned_end` | error |
/// | `orphaned_node` | error |
/// | `missing_true_path`, `missing_false_path` | warning |
/// | `unreachable_node` | warning |
/// | `duplicate_node_id`, `dangling_edge` | error |
///
/// ### Contracts
/// - **Never throws** for any graph, however malformed.
/// - **Exhaustive**: every rule runs, and every violation is reported.
/// - The summary is populated whether or not the graph is valid.
///
/// @implNote Stateless and thread-safe. The rule list is copied at construction time.
///
/// @see ValidationRule
/// @see OverlapDetector for the separate layout check
public final class FlowValidator {

    private static final Logger logger = Logger.getLogger(FlowValidator.class.getName());

    private final List<ValidationRule> rules;

    /// Creates a validator with a custom rule list.
    ///
    /// @param rules rules run in list order, not null
    public FlowValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /// Creates a validator with the standard rules.
    public FlowValidator() {
        this(standardRules());
    }

    /// Returns the standard rules in reporting order.
    public static List<ValidationRule> standardRules() {
        return List.of(
                new StartEndRule(),
                new ConnectionRule(),
                new BranchRule(),
                new ReachabilityRule(),
                new IntegrityRule());
    }

    /// Validates a graph.
    ///
    /// @param graph graph to check, not null
    /// @return result with issues and summary, never null
    public ValidationResult validate(FlowGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationRule rule : rules) {
            issues.addAll(rule.check(graph));
        }
        ValidationResult result = ValidationResult.of(issues, summarize(graph));
        logger.fine(
                () ->
                        "Validated graph " + graph + ": "
                                + result.errors().size() + " errors, "
                                + result.warnings().size() + " warnings");
        return result;
    }

    private static ValidationSummary summarize(FlowGraph graph) {
        return new ValidationSummary(
                graph.getNodes().size(),
                graph.getEdges().size(),
                graph.nodesOfKind(NodeType.START).size(),
                graph.nodesOfKind(NodeType.END).size(),
                Reachability.fromStarts(graph).size());
    }
}
