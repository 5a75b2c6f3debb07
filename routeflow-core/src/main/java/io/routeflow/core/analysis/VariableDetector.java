package io.routeflow.core.analysis;

import io.routeflow.core.expression.ExpressionReferences;
import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.ConditionNode;
import io.routeflow.core.graph.node.InputNode;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Finds the test variables a graph's conditions depend on.
///
/// System variables come first, then session variables, then plain variables. Plain
/// variables bound by an Input node of the same graph are left out because the walk supplies
/// them.
///
/// @implNote Stateless and thread-safe.
public final class VariableDetector {

    static final String SYSTEM_DEFAULT = "1";
    static final String SESSION_DEFAULT = "test_value";

    /// Scans the Condition nodes of a graph.
    ///
    /// @param graph graph to scan, not null
    /// @return detected variables, never null
    public List<DetectedVariable> detect(FlowGraph graph) {
        Map<String, List<String>> system = new LinkedHashMap<>();
        Map<String, List<String>> session = new LinkedHashMap<>();
        Map<String, List<String>> plain = new LinkedHashMap<>();
        Set<String> bound = new HashSet<>();
        for (Node node : graph.nodesOfKind(NodeType.INPUT)) {
            bound.add(((InputNode) node).getVariableName());
        }
        for (Node node : graph.nodesOfKind(NodeType.CONDITION)) {
            ExpressionReferences refs =
                    ExpressionReferences.of(((ConditionNode) node).getExpression());
            refs.systemNames().forEach(name -> usedBy(system, name, node));
            refs.sessionKeys().forEach(key -> usedBy(session, key, node));
            for (String name : refs.plainNames()) {
                if (!bound.contains(name)) {
                    usedBy(plain, name, node);
                }
            }
        }
        List<DetectedVariable> detected = new ArrayList<>();
        system.forEach(
                (name, nodes) ->
                        detected.add(
                                new DetectedVariable(
                                        name, VariableKind.SYSTEM, DataType.guess(name),
                                        SYSTEM_DEFAULT, nodes)));
        session.forEach(
                (name, nodes) ->
                        detected.add(
                                new DetectedVariable(
                                        name, VariableKind.SESSION, DataType.guess(name),
                                        SESSION_DEFAULT, nodes)));
        plain.forEach(
                (name, nodes) ->
                        detected.add(
                                new DetectedVariable(
                                        name, VariableKind.PLAIN, DataType.guess(name), null,
                                        nodes)));
        return detected;
    }

    /// Builds a configuration holding the default value of every detected variable that has one.
    ///
    /// @param graph graph to scan, not null
    /// @return configuration map in detection order, never null
    public Map<String, String> defaultConfiguration(FlowGraph graph) {
        Map<String, String> configuration = new LinkedHashMap<>();
        for (DetectedVariable variable : detect(graph)) {
            if (variable.defaultValue() != null) {
                configuration.put(variable.name(), variable.defaultValue());
            }
        }
        return configuration;
    }

    private static void usedBy(Map<String, List<String>> target, String name, Node node) {
        List<String> nodes = target.computeIfAbsent(name, key -> new ArrayList<>());
        if (!nodes.contains(node.getId())) {
            nodes.add(node.getId());
        }
    }
}
