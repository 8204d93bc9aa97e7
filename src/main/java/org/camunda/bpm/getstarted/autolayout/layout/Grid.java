package org.camunda.bpm.getstarted.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.layout.models.GridCell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cells placed during one layout run. Holds at most one node per (row, column).
 */
@Slf4j
public class Grid {
    private final Map<String, GridCell> cellsByNodeId = new LinkedHashMap<>();

    public GridCell cellOf(String nodeId) {
        return cellsByNodeId.get(nodeId);
    }

    public boolean contains(String nodeId) {
        return cellsByNodeId.containsKey(nodeId);
    }

    public boolean isOccupied(int row, int column) {
        return cellsByNodeId.values().stream()
                .anyMatch(cell -> cell.row() == row && cell.column() == column);
    }

    /**
     * Puts a node at (row, column). When the cell is taken, every cell at or below
     * {@code row} moves down by {@code stride} rows first.
     *
     * @return the cell of the inserted node
     */
    public GridCell insert(int row, int column, String nodeId, int stride) {
        if (cellsByNodeId.containsKey(nodeId)) {
            throw new IllegalStateException("Node '" + nodeId + "' is already placed");
        }
        if (isOccupied(row, column)) {
            log.debug("Cell ({}, {}) is taken, shifting rows >= {} by {}", row, column, row, stride);
            cellsByNodeId.replaceAll((id, cell) -> cell.row() >= row ? cell.shiftedBy(stride) : cell);
        }
        GridCell cell = new GridCell(row, column, nodeId);
        cellsByNodeId.put(nodeId, cell);
        return cell;
    }

    public Map<String, GridCell> cellsByNodeId() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cellsByNodeId));
    }

    public List<GridCell> cells() {
        return List.copyOf(new ArrayList<>(cellsByNodeId.values()));
    }

    public int size() {
        return cellsByNodeId.size();
    }
}
