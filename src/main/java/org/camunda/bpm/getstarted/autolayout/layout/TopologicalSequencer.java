package org.camunda.bpm.getstarted.autolayout.layout;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.exceptions.CycleBreakFailureException;
import org.camunda.bpm.getstarted.autolayout.exceptions.MalformedGraphException;
import org.camunda.bpm.getstarted.autolayout.layout.models.SequencingResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the nodes of a process so that every flow points forward, dropping the
 * incoming flows of Joins when only cycles are left.
 * <p>
 * Works on private copies of the adjacency lists; the graph itself is not modified.
 */
@Slf4j
public class TopologicalSequencer {

    private enum Phase {
        SEQUENCE_READY_NODES,
        BREAK_CYCLES
    }

    private final ProcessGraph graph;
    private final Map<String, Set<NodeRole>> classification;
    private final int iterationLimit;

    private final Map<String, Set<String>> workingIncoming = new HashMap<>();
    private final Map<String, Set<String>> workingOutgoing = new HashMap<>();
    private final Set<String> remaining = new LinkedHashSet<>();
    private final List<String> order = new ArrayList<>();
    private final Set<String> backwardFlowIds = new LinkedHashSet<>();

    public TopologicalSequencer(ProcessGraph graph, Map<String, Set<NodeRole>> classification, int iterationLimit) {
        this.graph = graph;
        this.classification = classification;
        this.iterationLimit = iterationLimit;
    }

    public static SequencingResult sequence(ProcessGraph graph, Map<String, Set<NodeRole>> classification,
                                            int iterationLimit) {
        return new TopologicalSequencer(graph, classification, iterationLimit).run();
    }

    public SequencingResult run() {
        for (FlowNode node : graph.nodesById().values()) {
            workingIncoming.put(node.id(), new LinkedHashSet<>(node.incomingFlowIds()));
            workingOutgoing.put(node.id(), new LinkedHashSet<>(node.outgoingFlowIds()));
            remaining.add(node.id());
        }

        int iterations = 0;
        while (!remaining.isEmpty()) {
            iterations++;
            if (iterations > iterationLimit) {
                throw new CycleBreakFailureException(
                        "Sequencing did not finish within " + iterationLimit + " iterations.", List.copyOf(remaining));
            }

            List<String> ready = remaining.stream()
                    .filter(nodeId -> workingIncoming.get(nodeId).isEmpty())
                    .toList();
            Phase phase = ready.isEmpty() ? Phase.BREAK_CYCLES : Phase.SEQUENCE_READY_NODES;

            switch (phase) {
                case SEQUENCE_READY_NODES -> ready.forEach(this::sequenceNode);
                case BREAK_CYCLES -> {
                    int dropped = dropJoinIncomingFlows();
                    if (dropped == 0) {
                        throw new CycleBreakFailureException(
                                "Every remaining node has an incoming flow and none of them is a Join.",
                                List.copyOf(remaining));
                    }
                }
            }
        }

        log.debug("Sequenced {} nodes in {} iterations, backward flows: {}", order.size(), iterations, backwardFlowIds);
        return new SequencingResult(order, backwardFlowIds);
    }

    private void sequenceNode(String nodeId) {
        remaining.remove(nodeId);
        order.add(nodeId);

        Set<String> outgoing = workingOutgoing.get(nodeId);
        for (String flowId : List.copyOf(outgoing)) {
            outgoing.remove(flowId);
            SequenceFlow flow = flow(flowId);
            Set<String> targetIncoming = workingIncoming.get(flow.targetRef());
            if (targetIncoming == null) {
                throw new MalformedGraphException(String.format(
                        "Sequence flow '%s' targets unknown node '%s'", flowId, flow.targetRef()));
            }
            targetIncoming.remove(flowId);
        }
    }

    private int dropJoinIncomingFlows() {
        int dropped = 0;
        for (String nodeId : remaining) {
            if (!classification.getOrDefault(nodeId, Set.of()).contains(NodeRole.JOIN)) {
                continue;
            }
            Set<String> incoming = workingIncoming.get(nodeId);
            for (String flowId : List.copyOf(incoming)) {
                incoming.remove(flowId);
                SequenceFlow flow = flow(flowId);
                Set<String> sourceOutgoing = workingOutgoing.get(flow.sourceRef());
                if (sourceOutgoing == null) {
                    throw new MalformedGraphException(String.format(
                            "Sequence flow '%s' starts at unknown node '%s'", flowId, flow.sourceRef()));
                }
                sourceOutgoing.remove(flowId);
                backwardFlowIds.add(flowId);
                dropped++;
                log.debug("Dropped flow {} into join {} to break a cycle", flowId, nodeId);
            }
        }
        return dropped;
    }

    private SequenceFlow flow(String flowId) {
        SequenceFlow flow = graph.flowsById().get(flowId);
        if (flow == null) {
            throw new MalformedGraphException("Unknown sequence flow '" + flowId + "'");
        }
        return flow;
    }
}
