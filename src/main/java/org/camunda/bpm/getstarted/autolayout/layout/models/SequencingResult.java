package org.camunda.bpm.getstarted.autolayout.layout.models;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of the topological sequencer.
 *
 * @param order           node ids; every non-backward flow points from an earlier to a later node
 * @param backwardFlowIds flows dropped to break cycles, in the order they were dropped
 */
public record SequencingResult(
        List<String> order,
        Set<String> backwardFlowIds
) {
    public SequencingResult {
        order = List.copyOf(order);
        backwardFlowIds = Collections.unmodifiableSet(new LinkedHashSet<>(backwardFlowIds));
    }

    public int positionOf(String nodeId) {
        return order.indexOf(nodeId);
    }

    public boolean isBackward(String flowId) {
        return backwardFlowIds.contains(flowId);
    }
}
