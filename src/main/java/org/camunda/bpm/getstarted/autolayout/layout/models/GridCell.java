package org.camunda.bpm.getstarted.autolayout.layout.models;

/**
 * Integer grid address of a placed node, before mapping to pixels.
 */
public record GridCell(int row, int column, String nodeId) {

    public GridCell shiftedBy(int rows) {
        return new GridCell(row + rows, column, nodeId);
    }
}
