package org.camunda.bpm.getstarted.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.autolayout.exceptions.MalformedGraphException;
import org.camunda.bpm.getstarted.autolayout.exceptions.MissingPredecessorCellException;
import org.camunda.bpm.getstarted.autolayout.layout.models.GridCell;
import org.camunda.bpm.getstarted.autolayout.layout.models.PlacementRequest;
import org.camunda.bpm.getstarted.autolayout.layout.models.SequencingResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every node a grid cell, visiting nodes in sequencer order.
 * <ul>
 *   <li>no predecessor: new chain at the next free row, start column</li>
 *   <li>one predecessor: same row, next column</li>
 *   <li>Join: column after the rightmost predecessor, row is the floored mean of the predecessor rows;
 *   a join fanned out by a split takes the row the split gave it and only looks at the predecessors placed so far</li>
 *   <li>Split: successors go to the next column, fanned out symmetrically around the split's row</li>
 * </ul>
 * Backward flows are ignored when looking for predecessors and successors.
 */
@Slf4j
public class GridPlacer {
    private final ProcessGraph graph;
    private final Map<String, Set<NodeRole>> classification;
    private final Set<String> backwardFlowIds;
    private final int rowStride;
    private final int startColumn;

    private final Grid grid = new Grid();
    private int nextRow;

    public GridPlacer(ProcessGraph graph, Map<String, Set<NodeRole>> classification, Set<String> backwardFlowIds,
                      LayoutConfig config) {
        this.graph = graph;
        this.classification = classification;
        this.backwardFlowIds = backwardFlowIds;
        this.rowStride = config.rowStride();
        this.startColumn = config.startColumn();
        this.nextRow = config.rowStride();
    }

    public static Grid place(ProcessGraph graph, Map<String, Set<NodeRole>> classification,
                             SequencingResult sequencing, LayoutConfig config) {
        return new GridPlacer(graph, classification, sequencing.backwardFlowIds(), config).place(sequencing.order());
    }

    public Grid place(List<String> order) {
        for (String nodeId : order) {
            if (!grid.contains(nodeId)) {
                process(PlacementRequest.unforced(nodeId));
            }
        }
        return grid;
    }

    /**
     * Places the requested node and, depth first, every successor fanned out by a split on the way.
     */
    private void process(PlacementRequest initial) {
        Deque<PlacementRequest> pending = new ArrayDeque<>();
        pending.push(initial);

        while (!pending.isEmpty()) {
            PlacementRequest request = pending.pop();
            if (grid.contains(request.nodeId())) {
                continue;
            }
            GridCell cell = placeNode(request);

            if (roles(request.nodeId()).contains(NodeRole.SPLIT)) {
                List<PlacementRequest> fanOut = fanOut(node(request.nodeId()), cell);
                // reversed so that the first successor is taken from the stack first
                for (int i = fanOut.size() - 1; i >= 0; i--) {
                    pending.push(fanOut.get(i));
                }
            }
        }
    }

    GridCell placeNode(PlacementRequest request) {
        FlowNode node = node(request.nodeId());
        List<String> predecessors = forwardPredecessors(node);

        int row;
        int column;
        if (predecessors.isEmpty()) {
            row = request.hasForcedRow() ? request.forcedRow() : nextRow;
            column = startColumn;
            nextRow += rowStride;
        } else if (!roles(node.id()).contains(NodeRole.JOIN)) {
            GridCell predecessorCell = cellOf(node.id(), predecessors.get(0));
            row = request.hasForcedRow() ? request.forcedRow() : predecessorCell.row();
            column = predecessorCell.column() + 1;
        } else if (request.hasForcedRow()) {
            // fanned out by a split: the other branches into this join may not be placed yet
            int maxColumn = Integer.MIN_VALUE;
            for (String predecessorId : predecessors) {
                GridCell predecessorCell = grid.cellOf(predecessorId);
                if (predecessorCell != null) {
                    maxColumn = Math.max(maxColumn, predecessorCell.column());
                }
            }
            if (maxColumn == Integer.MIN_VALUE) {
                throw new MissingPredecessorCellException(node.id(), predecessors.get(0));
            }
            row = request.forcedRow();
            column = maxColumn + 1;
        } else {
            int maxColumn = Integer.MIN_VALUE;
            int rowSum = 0;
            for (String predecessorId : predecessors) {
                GridCell predecessorCell = cellOf(node.id(), predecessorId);
                rowSum += predecessorCell.row();
                maxColumn = Math.max(maxColumn, predecessorCell.column());
            }
            row = Math.floorDiv(rowSum, predecessors.size());
            column = maxColumn + 1;
        }

        GridCell cell = grid.insert(row, column, node.id(), rowStride);
        log.debug("Placed {} at row {}, column {}{}", node.id(), cell.row(), cell.column(),
                request.hasForcedRow() ? " (forced)" : "");
        return cell;
    }

    /**
     * Builds the placement requests of a split's successors that are not placed yet.
     * With an odd count the middle successor keeps the split's row; the ones before it
     * go to rows row + k * stride, the ones after it to row - k * stride.
     */
    List<PlacementRequest> fanOut(FlowNode split, GridCell splitCell) {
        List<String> successors = new ArrayList<>();
        for (String successorId : forwardSuccessors(split)) {
            if (!grid.contains(successorId)) {
                successors.add(successorId);
            }
        }

        int count = successors.size();
        int centre = count / 2;
        int splitRow = splitCell.row();
        List<PlacementRequest> requests = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            int offset;
            if (count % 2 != 0) {
                offset = index < centre ? index + 1 : -(index - centre);
            } else {
                offset = index < centre ? index + 1 : -(index - centre + 1);
            }
            requests.add(new PlacementRequest(successors.get(index), splitRow + offset * rowStride));
        }
        return requests;
    }

    private List<String> forwardPredecessors(FlowNode node) {
        Set<String> predecessors = new LinkedHashSet<>();
        for (String flowId : node.incomingFlowIds()) {
            if (!backwardFlowIds.contains(flowId)) {
                predecessors.add(flow(flowId).sourceRef());
            }
        }
        return new ArrayList<>(predecessors);
    }

    private List<String> forwardSuccessors(FlowNode node) {
        Set<String> successors = new LinkedHashSet<>();
        for (String flowId : node.outgoingFlowIds()) {
            if (!backwardFlowIds.contains(flowId)) {
                successors.add(flow(flowId).targetRef());
            }
        }
        return new ArrayList<>(successors);
    }

    private GridCell cellOf(String nodeId, String predecessorId) {
        GridCell cell = grid.cellOf(predecessorId);
        if (cell == null) {
            throw new MissingPredecessorCellException(nodeId, predecessorId);
        }
        return cell;
    }

    private Set<NodeRole> roles(String nodeId) {
        return classification.getOrDefault(nodeId, Set.of(NodeRole.ELEMENT));
    }

    private FlowNode node(String nodeId) {
        FlowNode node = graph.nodesById().get(nodeId);
        if (node == null) {
            throw new MalformedGraphException("Unknown node '" + nodeId + "'");
        }
        return node;
    }

    private SequenceFlow flow(String flowId) {
        SequenceFlow flow = graph.flowsById().get(flowId);
        if (flow == null) {
            throw new MalformedGraphException("Unknown sequence flow '" + flowId + "'");
        }
        return flow;
    }
}
