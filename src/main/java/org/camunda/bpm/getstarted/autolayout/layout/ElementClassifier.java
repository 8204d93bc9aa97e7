package org.camunda.bpm.getstarted.autolayout.layout;

import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ElementClassifier {

    private ElementClassifier() {
    }

    /**
     * Tags a node with its structural roles.
     * Every node is an Element; start/end events get their event role; two or more
     * incoming flows make a Join, two or more outgoing flows a Split.
     */
    public static Set<NodeRole> classify(FlowNode node) {
        EnumSet<NodeRole> roles = EnumSet.of(NodeRole.ELEMENT);
        if (node.type().isStartEvent()) {
            roles.add(NodeRole.START_EVENT);
        }
        if (node.type().isEndEvent()) {
            roles.add(NodeRole.END_EVENT);
        }
        if (node.incomingFlowIds().size() >= 2) {
            roles.add(NodeRole.JOIN);
        }
        if (node.outgoingFlowIds().size() >= 2) {
            roles.add(NodeRole.SPLIT);
        }
        return Collections.unmodifiableSet(roles);
    }

    /**
     * Classifies every node of the graph, keyed by node id in graph order.
     */
    public static Map<String, Set<NodeRole>> classify(ProcessGraph graph) {
        Map<String, Set<NodeRole>> classification = new LinkedHashMap<>();
        for (FlowNode node : graph.nodesById().values()) {
            classification.put(node.id(), classify(node));
        }
        return Collections.unmodifiableMap(classification);
    }
}
