package io.routeflow.core.validation;

import io.routeflow.core.graph.FlowGraph;
import io.routeflow.core.graph.node.Node;
import io.routeflow.core.graph.node.NodeType;
import io.routeflow.core.graph.node.Position;
import java.util.ArrayList;
import java.util.List;

/// Finds nodes whose nominal canvas boxes overlap.
///
/// A layout aid only: its findings never feed into {@link ValidationResult}. Box size depends on
/// the node kind alone; boxes closer than a fixed padding count as overlapping. Nodes without a
/// position are skipped.
public final class OverlapDetector {

    static final double PADDING = 20;

    /// Nominal width and height of a node kind on the canvas.
    public record Size(double width, double height) {}

    /// Returns the nominal box size of a node kind.
    public static Size sizeOf(NodeType type) {
        return switch (type) {
            case START, END -> new Size(120, 50);
            case INPUT, CONDITION -> new Size(150, 120);
            case FUNCTION -> new Size(180, 160);
        };
    }

    /// Reports every overlapping pair once, in authoring order.
    ///
    /// @param graph graph to inspect, not null
    /// @return `node_overlap` warnings, never null
    public List<ValidationIssue> detect(FlowGraph graph) {
        List<Node> placed = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            if (node.getPosition() != null) {
                placed.add(node);
            }
        }
        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                Node first = placed.get(i);
                Node second = placed.get(j);
                if (overlaps(first, second)) {
                    issues.add(
                            ValidationIssue.forNodes(
                                    IssueKind.NODE_OVERLAP,
                                    "Nodes \"" + first.getLabel() + "\" and \""
                                            + second.getLabel() + "\" are overlapping",
                                    List.of(first.getId(), second.getId())));
                }
            }
        }
        return issues;
    }

    private static boolean overlaps(Node first, Node second) {
        Position a = first.getPosition();
        Position b = second.getPosition();
        Size sa = sizeOf(first.getNodeType());
        Size sb = sizeOf(second.getNodeType());
        return a.x() + sa.width() + PADDING >= b.x()
                && b.x() + sb.width() + PADDING >= a.x()
                && a.y() + sa.height() + PADDING >= b.y()
                && b.y() + sb.height() + PADDING >= a.y();
    }
}
