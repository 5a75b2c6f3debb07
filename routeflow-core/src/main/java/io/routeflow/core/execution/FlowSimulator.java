package io.routeflow.core.execution;

import io.routeflow.core.expression.ConditionResult;
import io.routeflow.core.expression.ExpressionDiagnostics;
import io.routeflow.core.expression.ExpressionError;
import io.routeflow.core.expression.ExpressionEvaluator;
import io.routeflow.core.expression.ExpressionException;
import io.routeflow.core.expression.Values;
import io.routeflow.core.graph.Branch;
import io.routeflow.core.graph.Edge;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.FunctionNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.StartNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Walks a graph and records what each node does.
///
/// The walk is depth-first from the first Start node. Every followed edge starts a branch with
/// its own copy of the variables, so a condition with both outcomes wired produces two full
/// sub-walks in pre-order.
///
/// ### Per node
/// - **Start**: follows every outgoing edge
/// - **Input**: binds the parsed literal, follows every outgoing edge
/// - **Condition**: evaluates the expression, follows the edges serving the outcome; no such
///   edge is a warning and the path stops; an evaluation failure is an error and the path stops
/// - **Function**: runs the body; a record result is merged into the variables, anything else
///   is bound to `result`; a failure is an error and the path stops
/// - **End**: records completion, the path stops
///
/// ### Contracts
/// - **Never throws** for a graph, however malformed. A graph without Start nodes yields a
///   single `no_start_node` entry.
/// - **Terminates**: a node already on the current path is not re-entered, and the total
///   number of node visits is capped by the step budget.
/// - **Deterministic**: equal inputs produce equal traces, given a deterministic evaluator.
///
/// @implNote Thread-safe. Each call keeps its state on the stack.
///
/// @see ExecutionTrace
public final class FlowSimulator {

    private static final Logger logger = Logger.getLogger(FlowSimulator.class.getName());

    static final String SYSTEM_NODE_ID = "system";

    private final ExpressionEvaluator expressionEvaluator;
    private final FunctionBodyEvaluator functionEvaluator;
    private final int maxSteps;

    /// Creates a simulator.
    ///
    /// @param expressionEvaluator condition evaluator, not null
    /// @param functionEvaluator function body evaluator, not null
    /// @param maxSteps maximum node visits per run, positive
    public FlowSimulator(
            ExpressionEvaluator expressionEvaluator,
            FunctionBodyEvaluator functionEvaluator,
            int maxSteps) {
        this.expressionEvaluator =
                Objects.requireNonNull(expressionEvaluator, "expressionEvaluator required");
        this.functionEvaluator =
                Objects.requireNonNull(functionEvaluator, "functionEvaluator required");
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /// Simulates a run without a listener.
    ///
    /// @see #simulate(FlowGraph, Map, SimulationListener)
    public ExecutionTrace simulate(FlowGraph graph, Map<String, String> configuration) {
        return simulate(graph, configuration, SimulationListener.NOOP);
    }

    /// Simulates a run.
    ///
    /// @param graph graph to walk, not null
    /// @param configuration test configuration for substitution and helpers, not null
    /// @param listener receives every entry as it is recorded, not null
    /// @return the trace, never null
    public ExecutionTrace simulate(
            FlowGraph graph, Map<String, String> configuration, SimulationListener listener) {
        Walk walk = new Walk(graph, Map.copyOf(configuration), listener);
        Optional<StartNode> start = graph.firstStart();
        if (start.isEmpty()) {
            walk.record(
                    StepRecord.builder()
                            .nodeId(SYSTEM_NODE_ID)
                            .code(StepCode.NO_START_NODE)
                            .message("No start node found"));
        } else {
            walk.visit(start.get(), new VariableEnvironment());
        }
        ExecutionTrace trace = new ExecutionTrace(walk.steps);
        logger.fine(() -> "Simulated " + graph + " in " + trace.steps().size() + " steps");
        listener.onComplete(trace);
        return trace;
    }

    /// State of one run.
    private final class Walk {

        private final FlowGraph graph;
        private final Map<String, String> configuration;
        private final SimulationListener listener;
        private final List<StepRecord> steps = new ArrayList<>();
        private final Set<String> path = new LinkedHashSet<>();
        private int visits;
        private boolean exhausted;

        Walk(FlowGraph graph, Map<String, String> configuration, SimulationListener listener) {
            this.graph = graph;
            this.configuration = configuration;
            this.listener = listener;
        }

        void visit(Node node, VariableEnvironment env) {
            if (exhausted) {
                return;
            }
            if (++visits > maxSteps) {
                exhausted = true;
                logger.warning("Step budget of " + maxSteps + " exhausted at node " + node.getId());
                record(
                        entry(node, env, StepCode.STEP_LIMIT_REACHED)
                                .message("Step limit of " + maxSteps + " reached; walk stopped"));
                return;
            }
            path.add(node.getId());
            record(
                    entry(node, env, StepCode.NODE_VISITED)
                            .position(node.getPosition())
                            .message(
                                    "Executing " + node.getNodeType().typeName() + " node: "
                                            + node.getLabel()));
            switch (node.getNodeType()) {
                case START -> followAll(node, env);
                case INPUT -> runInput((InputNode) node, env);
                case CONDITION -> runCondition((ConditionNode) node, env);
                case FUNCTION -> runFunction((FunctionNode) node, env);
                case END ->
                        record(
                                entry(node, env, StepCode.FLOW_COMPLETED)
                                        .message("Flow completed"));
            }
            path.remove(node.getId());
        }

        private void runInput(InputNode input, VariableEnvironment env) {
            env.bind(input.getVariableName(), input.parsedValue());
            record(
                    entry(input, env, StepCode.VARIABLE_SET)
                            .message(
                                    "Set " + input.getVariableName() + " = "
                                            + input.getLiteralValue()));
            followAll(input, env);
        }

        private void runCondition(ConditionNode condition, VariableEnvironment env) {
            String expression = condition.getExpression();
            ConditionResult result;
            try {
                result = expressionEvaluator.evaluate(expression, env.asMap(), configuration);
            } catch (ExpressionException e) {
                logger.fine(() -> "Condition " + condition.getId() + " failed: " + e.getMessage());
                ExpressionError error = ExpressionDiagnostics.diagnose(e, availableNames(env));
                String substituted =
                        expressionEvaluator.substitute(expression, env.asMap(), configuration);
                record(
                        entry(condition, env, StepCode.CONDITION_ERROR)
                                .message("Error evaluating condition: " + error.message())
                                .conditionDetail(new ConditionDetail(expression, substituted, null))
                                .suggestion(error.suggestion()));
                return;
            }
            record(
                    entry(condition, env, StepCode.CONDITION_EVALUATED)
                            .message(
                                    "Condition \"" + expression + "\" → \""
                                            + result.displayExpression() + "\" = " + result.value())
                            .conditionDetail(
                                    new ConditionDetail(
                                            expression,
                                            result.displayExpression(),
                                            result.value())));
            Branch branch = Branch.of(result.value());
            List<Edge> edges = graph.edgesFrom(condition.getId(), branch);
            if (edges.isEmpty()) {
                record(
                        entry(
                                        condition,
                                        env,
                                        branch == Branch.TRUE
                                                ? StepCode.MISSING_TRUE_PATH
                                                : StepCode.MISSING_FALSE_PATH)
                                .message(
                                        "No " + branch.name()
                                                + " path connected from this condition"));
                return;
            }
            follow(condition, edges, env);
        }

        private void runFunction(FunctionNode function, VariableEnvironment env) {
            Object result;
            try {
                result = functionEvaluator.evaluate(function.getBody(), env.asMap());
            } catch (ExpressionException e) {
                logger.fine(() -> "Function " + function.getId() + " failed: " + e.getMessage());
                ExpressionError error = ExpressionDiagnostics.diagnose(e, env.asMap().keySet());
                record(
                        entry(function, env, StepCode.FUNCTION_ERROR)
                                .message("Error executing function: " + error.message())
                                .suggestion(error.suggestion()));
                return;
            }
            if (result instanceof Map<?, ?> outputs) {
                env.merge(outputs);
            } else {
                env.bind("result", result);
            }
            record(
                    entry(function, env, StepCode.FUNCTION_EXECUTED)
                            .message("Function executed, result: " + Values.toJson(result)));
            followAll(function, env);
        }

        private void followAll(Node node, VariableEnvironment env) {
            follow(node, graph.edgesFrom(node.getId()), env);
        }

        private void follow(Node from, List<Edge> edges, VariableEnvironment env) {
            for (Edge edge : edges) {
                Optional<Node> target = graph.node(edge.target());
                if (target.isEmpty()) {
                    record(
                            entry(from, env, StepCode.DANGLING_EDGE)
                                    .message(
                                            "Edge \"" + edge.id() + "\" points to missing node \""
                                                    + edge.target() + "\""));
                    continue;
                }
                if (path.contains(edge.target())) {
                    record(
                            entry(from, env, StepCode.CYCLE_DETECTED)
                                    .message(
                                            "Node \"" + target.get().getLabel()
                                                    + "\" is already on the current path;"
                                                    + " not entered again"));
                    continue;
                }
                visit(target.get(), env.copy());
            }
        }

        private Set<String> availableNames(VariableEnvironment env) {
            Set<String> names = new LinkedHashSet<>(env.asMap().keySet());
            names.addAll(configuration.keySet());
            return names;
        }

        private StepRecord.Builder entry(Node node, VariableEnvironment env, StepCode code) {
            return StepRecord.builder()
                    .nodeId(node.getId())
                    .code(code)
                    .variablesSnapshot(env.snapshot());
        }

        void record(StepRecord.Builder builder) {
            StepRecord step = builder.build();
            steps.add(step);
            listener.onStep(step);
        }
    }
}
