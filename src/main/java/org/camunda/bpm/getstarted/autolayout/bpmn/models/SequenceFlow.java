package org.camunda.bpm.getstarted.autolayout.bpmn.models;

import java.util.List;

/**
 * Represents a BPMN SequenceFlow connecting two nodes in a process.
 *
 * @param id        the unique identifier of the sequence flow
 * @param name      the name/label of the sequence flow
 * @param sourceRef id of the node the flow leaves
 * @param targetRef id of the node the flow enters
 * @param waypoints rendered polyline, empty until a layout has been committed
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef,
        List<Waypoint> waypoints
) {
    public SequenceFlow {
        waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    // Constructor for flows that have not been laid out yet
    public SequenceFlow(String id, String name, String sourceRef, String targetRef) {
        this(id, name, sourceRef, targetRef, List.of());
    }

    public SequenceFlow withWaypoints(List<Waypoint> newWaypoints) {
        return new SequenceFlow(id, name, sourceRef, targetRef, newWaypoints);
    }
}
