package org.camunda.bpm.getstarted.autolayout.layout;

import org.camunda.bpm.getstarted.autolayout.bpmn.models.Bounds;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.NodeType;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Waypoint;

import java.util.List;

/**
 * Orthogonal routing heuristic for sequence flows. Routes do not avoid other
 * nodes and may overlap.
 */
public class WaypointRouter {

    private WaypointRouter() {
    }

    /**
     * Computes the polyline of one flow.
     *
     * @param source     bounds of the flow's source node
     * @param sourceType type of the source node
     * @param target     bounds of the flow's target node
     * @param targetType type of the target node
     * @return two or three waypoints, from the source to the target
     */
    public static List<Waypoint> route(Bounds source, NodeType sourceType, Bounds target, NodeType targetType) {
        if (sourceType.isBranchingGateway()) {
            // leave the gateway vertically, enter the target from the left
            return List.of(
                    new Waypoint(source.centerX(), source.centerY()),
                    new Waypoint(source.centerX(), target.centerY()),
                    new Waypoint(target.x(), target.centerY()));
        }
        if (source.y() == target.y()) {
            return direct(source, target);
        }
        if (targetType.isBranchingGateway()) {
            // go horizontally first, then enter the gateway from above or below
            double entryY = target.y() > source.y() ? target.y() : target.bottom();
            return List.of(
                    new Waypoint(source.right(), source.centerY()),
                    new Waypoint(target.centerX(), source.centerY()),
                    new Waypoint(target.centerX(), entryY));
        }
        return direct(source, target);
    }

    private static List<Waypoint> direct(Bounds source, Bounds target) {
        return List.of(
                new Waypoint(source.right(), source.centerY()),
                new Waypoint(target.x(), target.centerY()));
    }
}
