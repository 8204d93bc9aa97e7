package org.camunda.bpm.getstarted.autolayout.layout.models;

import org.camunda.bpm.getstarted.autolayout.bpmn.models.Bounds;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Waypoint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one layout run computed and committed to the graph.
 */
public record LayoutResult(
        List<String> order,
        Set<String> backwardFlowIds,
        Map<String, GridCell> cellsByNodeId,   // in placement order
        Map<String, Bounds> boundsByNodeId,
        Map<String, List<Waypoint>> waypointsByFlowId
) {
    public LayoutResult {
        order = List.copyOf(order);
        backwardFlowIds = Set.copyOf(backwardFlowIds);
        cellsByNodeId = Collections.unmodifiableMap(new LinkedHashMap<>(cellsByNodeId));
        boundsByNodeId = Map.copyOf(boundsByNodeId);
        waypointsByFlowId = Map.copyOf(waypointsByFlowId);
    }

    public List<GridCell> cells() {
        return List.copyOf(cellsByNodeId.values());
    }

    /**
     * Returns the cell of a node, or null if the node was not part of the run.
     */
    public GridCell cellOf(String nodeId) {
        return cellsByNodeId.get(nodeId);
    }
}
