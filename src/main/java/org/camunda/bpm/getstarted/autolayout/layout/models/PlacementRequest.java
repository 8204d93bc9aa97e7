package org.camunda.bpm.getstarted.autolayout.layout.models;

/**
 * A pending placement of one node.
 *
 * @param nodeId    node to place
 * @param forcedRow row imposed by a split fanning out its successors, null to let the
 *                  placement rules pick the row
 */
public record PlacementRequest(String nodeId, Integer forcedRow) {

    public static PlacementRequest unforced(String nodeId) {
        return new PlacementRequest(nodeId, null);
    }

    public boolean hasForcedRow() {
        return forcedRow != null;
    }
}
