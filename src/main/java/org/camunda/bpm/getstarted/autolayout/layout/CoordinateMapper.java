package org.camunda.bpm.getstarted.autolayout.layout;

import org.camunda.bpm.getstarted.autolayout.bpmn.models.Bounds;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.autolayout.layout.models.GridCell;

import java.util.LinkedHashMap;
import java.util.Map;

public class CoordinateMapper {

    private CoordinateMapper() {
    }

    public static double toX(int column, LayoutConfig config) {
        return (double) column * config.columnPitch() + config.margin();
    }

    public static double toY(int row, LayoutConfig config) {
        return (double) row * config.rowPitch() + config.margin();
    }

    public static Bounds toBounds(GridCell cell, LayoutConfig config) {
        return new Bounds(toX(cell.column(), config), toY(cell.row(), config), config.nodeWidth(), config.nodeHeight());
    }

    /**
     * Maps every cell of a finished grid to pixel bounds, keyed by node id.
     */
    public static Map<String, Bounds> map(Grid grid, LayoutConfig config) {
        Map<String, Bounds> boundsByNodeId = new LinkedHashMap<>();
        for (GridCell cell : grid.cells()) {
            boundsByNodeId.put(cell.nodeId(), toBounds(cell, config));
        }
        return boundsByNodeId;
    }
}
