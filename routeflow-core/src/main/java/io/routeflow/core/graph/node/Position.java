package io.routeflow.core.graph.node;

/// Canvas coordinates of a node. Carried through the engine untouched so trace entries can be
/// placed by a rendering layer.
///
/// @param x horizontal offset
/// @param y vertical offset
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}
