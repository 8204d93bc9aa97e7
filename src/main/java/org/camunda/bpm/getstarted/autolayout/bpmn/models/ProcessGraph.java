package org.camunda.bpm.getstarted.autolayout.bpmn.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single process as a directed graph. Both maps keep insertion order, which is
 * the order the layouter visits nodes and flows in.
 */
public record ProcessGraph(
        String id,
        String name,
        Map<String, FlowNode> nodesById,      // StartEvent, Tasks, Gateways, EndEvent, ...
        Map<String, SequenceFlow> flowsById   // SequenceFlow graph edges
) {
    public ProcessGraph {
        // always mutable, the layouter writes its results into these maps
        nodesById = nodesById == null ? new LinkedHashMap<>() : new LinkedHashMap<>(nodesById);
        flowsById = flowsById == null ? new LinkedHashMap<>() : new LinkedHashMap<>(flowsById);
    }

    public ProcessGraph(String id, String name) {
        this(id, name, new LinkedHashMap<>(), new LinkedHashMap<>());
    }
}
