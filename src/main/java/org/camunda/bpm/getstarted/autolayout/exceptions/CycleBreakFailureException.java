package org.camunda.bpm.getstarted.autolayout.exceptions;

import java.util.List;

/**
 * Thrown when the sequencer is left with nodes that all still have incoming flows
 * and none of them is a Join whose incoming flows could be dropped.
 */
public class CycleBreakFailureException extends LayoutException {
    private final List<String> remainingNodeIds;

    public CycleBreakFailureException(String message, List<String> remainingNodeIds) {
        super(message + " Remaining nodes: " + remainingNodeIds);
        this.remainingNodeIds = List.copyOf(remainingNodeIds);
    }

    public List<String> getRemainingNodeIds() {
        return remainingNodeIds;
    }
}
