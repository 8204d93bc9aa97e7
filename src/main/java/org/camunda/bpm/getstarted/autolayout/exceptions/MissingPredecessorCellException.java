package org.camunda.bpm.getstarted.autolayout.exceptions;

public class MissingPredecessorCellException extends LayoutException {
    private final String nodeId;
    private final String predecessorId;

    public MissingPredecessorCellException(String nodeId, String predecessorId) {
        super(String.format("Cannot place node '%s': predecessor '%s' has no grid cell.", nodeId, predecessorId));
        this.nodeId = nodeId;
        this.predecessorId = predecessorId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getPredecessorId() {
        return predecessorId;
    }
}
