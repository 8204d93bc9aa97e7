package org.camunda.bpm.getstarted.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.bpmn.ProcessGraphHelper;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Bounds;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Waypoint;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.autolayout.layout.models.GridCell;
import org.camunda.bpm.getstarted.autolayout.layout.models.LayoutResult;
import org.camunda.bpm.getstarted.autolayout.layout.models.SequencingResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the automatic layout.
 * <p>
 * A run goes through the following steps:
 * <ol>
 *   <li>classify the nodes (Element, Start Event, End Event, Join, Split)</li>
 *   <li>sequence them topologically, dropping backward flows to break cycles</li>
 *   <li>place them on an integer grid</li>
 *   <li>map grid cells to pixel bounds</li>
 *   <li>route every sequence flow</li>
 * </ol>
 * All steps work on private state. The graph is only updated once every step succeeded,
 * so a failing run leaves it untouched.
 */
@Slf4j
public class BpmnDiagramLayouter {

    private BpmnDiagramLayouter() {
    }

    public static LayoutResult generateLayout(ProcessGraph graph) {
        return generateLayout(graph, LayoutConfig.defaults());
    }

    /**
     * Lays out the graph and writes row, column and bounds to every node and
     * waypoints to every sequence flow.
     *
     * @param graph  the process graph, modified in place on success
     * @param config layout constants
     * @return what was computed and committed
     * @throws org.camunda.bpm.getstarted.autolayout.exceptions.LayoutException if the graph cannot be laid out
     */
    public static LayoutResult generateLayout(ProcessGraph graph, LayoutConfig config) {
        ProcessGraphHelper.validate(graph);

        Map<String, Set<NodeRole>> classification = ElementClassifier.classify(graph);
        int iterationLimit = config.sequencerIterationLimit(graph.nodesById().size(), graph.flowsById().size());
        SequencingResult sequencing = TopologicalSequencer.sequence(graph, classification, iterationLimit);
        Grid grid = GridPlacer.place(graph, classification, sequencing, config);
        Map<String, Bounds> boundsByNodeId = CoordinateMapper.map(grid, config);
        Map<String, List<Waypoint>> waypointsByFlowId = routeFlows(graph, boundsByNodeId);

        commit(graph, grid, boundsByNodeId, waypointsByFlowId);
        log.info("Laid out process '{}': {} nodes, {} flows, {} backward flows",
                graph.id(), graph.nodesById().size(), graph.flowsById().size(), sequencing.backwardFlowIds().size());

        return new LayoutResult(sequencing.order(), sequencing.backwardFlowIds(), grid.cellsByNodeId(),
                boundsByNodeId, waypointsByFlowId);
    }

    private static Map<String, List<Waypoint>> routeFlows(ProcessGraph graph, Map<String, Bounds> boundsByNodeId) {
        Map<String, List<Waypoint>> waypointsByFlowId = new LinkedHashMap<>();
        for (SequenceFlow flow : graph.flowsById().values()) {
            FlowNode source = graph.nodesById().get(flow.sourceRef());
            FlowNode target = graph.nodesById().get(flow.targetRef());
            List<Waypoint> waypoints = WaypointRouter.route(
                    boundsByNodeId.get(source.id()), source.type(),
                    boundsByNodeId.get(target.id()), target.type());
            waypointsByFlowId.put(flow.id(), waypoints);
        }
        return waypointsByFlowId;
    }

    private static void commit(ProcessGraph graph, Grid grid, Map<String, Bounds> boundsByNodeId,
                               Map<String, List<Waypoint>> waypointsByFlowId) {
        graph.nodesById().replaceAll((id, node) -> {
            GridCell cell = grid.cellOf(id);
            return node.toBuilder()
                    .row(cell.row())
                    .column(cell.column())
                    .bounds(boundsByNodeId.get(id))
                    .build();
        });
        graph.flowsById().replaceAll((id, flow) -> flow.withWaypoints(waypointsByFlowId.get(id)));
    }
}
