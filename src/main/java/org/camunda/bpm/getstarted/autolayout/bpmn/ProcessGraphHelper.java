package org.camunda.bpm.getstarted.autolayout.bpmn;

import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.NodeType;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.exceptions.MalformedGraphException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class ProcessGraphHelper {

    private ProcessGraphHelper() {
    }

    /**
     * Creates an empty process graph with a generated id.
     */
    public static ProcessGraph newGraph(String name) {
        return new ProcessGraph(generateId("process"), name == null ? "" : name);
    }

    /**
     * Adds a flow node to the graph, or changes type and name of an existing one.
     * An existing node keeps its incoming/outgoing flows.
     *
     * @param graph  the graph to modify
     * @param nodeId id of the node, generated when null
     * @param type   kind of the node
     * @param name   display name, may be null
     * @return the node as stored in the graph
     */
    public static FlowNode addFlowNode(ProcessGraph graph, String nodeId, NodeType type, String name) {
        String id = nodeId == null ? generateId(type.getBpmnName()) : nodeId;
        FlowNode existing = graph.nodesById().get(id);

        FlowNode node = existing == null
                ? new FlowNode(id, type, name)
                : existing.toBuilder().type(type).name(name).build();
        graph.nodesById().put(id, node);
        return node;
    }

    public static FlowNode addTask(ProcessGraph graph, String nodeId, String name) {
        return addFlowNode(graph, nodeId, NodeType.TASK, name);
    }

    public static FlowNode addSubProcess(ProcessGraph graph, String nodeId, String name) {
        return addFlowNode(graph, nodeId, NodeType.SUB_PROCESS, name);
    }

    public static FlowNode addStartEvent(ProcessGraph graph, String nodeId, String name) {
        return addFlowNode(graph, nodeId, NodeType.START_EVENT, name);
    }

    public static FlowNode addEndEvent(ProcessGraph graph, String nodeId, String name) {
        return addFlowNode(graph, nodeId, NodeType.END_EVENT, name);
    }

    public static FlowNode addGateway(ProcessGraph graph, String nodeId, String name, NodeType gatewayType) {
        if (!gatewayType.isGateway()) {
            throw new IllegalArgumentException("Not a gateway type: " + gatewayType.getBpmnName());
        }
        return addFlowNode(graph, nodeId, gatewayType, name);
    }

    /**
     * Connects two existing nodes. The flow id is appended to the source's outgoing
     * and the target's incoming list.
     *
     * @throws MalformedGraphException if either endpoint is not part of the graph
     *                                 or the flow id is already taken
     */
    public static SequenceFlow addSequenceFlow(ProcessGraph graph, String flowId, String sourceRef, String targetRef,
                                               String name) {
        FlowNode source = getNodeById(graph, sourceRef);
        FlowNode target = getNodeById(graph, targetRef);
        String id = flowId == null ? generateId("flow") : flowId;
        if (graph.flowsById().containsKey(id)) {
            throw new MalformedGraphException("Sequence flow '" + id + "' already exists");
        }

        SequenceFlow flow = new SequenceFlow(id, name == null ? "" : name, sourceRef, targetRef);
        graph.flowsById().put(id, flow);

        // self loops touch the same node twice, so re-read it after the first update
        graph.nodesById().put(sourceRef, source.toBuilder().outgoingFlowIds(append(source.outgoingFlowIds(), id)).build());
        FlowNode freshTarget = graph.nodesById().get(target.id());
        graph.nodesById().put(targetRef, freshTarget.toBuilder().incomingFlowIds(append(freshTarget.incomingFlowIds(), id)).build());
        return flow;
    }

    public static SequenceFlow addSequenceFlow(ProcessGraph graph, String flowId, String sourceRef, String targetRef) {
        return addSequenceFlow(graph, flowId, sourceRef, targetRef, "");
    }

    /**
     * Removes a sequence flow and detaches it from both endpoints.
     *
     * @throws MalformedGraphException if the flow does not exist
     */
    public static void deleteSequenceFlow(ProcessGraph graph, String flowId) {
        SequenceFlow flow = getFlowById(graph, flowId);
        graph.flowsById().remove(flowId);

        FlowNode source = graph.nodesById().get(flow.sourceRef());
        if (source != null) {
            graph.nodesById().put(source.id(), source.toBuilder().outgoingFlowIds(without(source.outgoingFlowIds(), flowId)).build());
        }
        FlowNode target = graph.nodesById().get(flow.targetRef());
        if (target != null) {
            graph.nodesById().put(target.id(), target.toBuilder().incomingFlowIds(without(target.incomingFlowIds(), flowId)).build());
        }
    }

    public static FlowNode getNodeById(ProcessGraph graph, String nodeId) {
        FlowNode node = graph.nodesById().get(nodeId);
        if (node == null) {
            throw new MalformedGraphException("Node '" + nodeId + "' does not exist in process '" + graph.id() + "'");
        }
        return node;
    }

    public static SequenceFlow getFlowById(ProcessGraph graph, String flowId) {
        SequenceFlow flow = graph.flowsById().get(flowId);
        if (flow == null) {
            throw new MalformedGraphException("Sequence flow '" + flowId + "' does not exist in process '" + graph.id() + "'");
        }
        return flow;
    }

    /**
     * Returns all nodes of the given type in insertion order. A null type returns every node.
     */
    public static List<FlowNode> getNodes(ProcessGraph graph, NodeType type) {
        return graph.nodesById().values().stream()
                .filter(node -> type == null || node.type() == type)
                .toList();
    }

    /**
     * Checks that every flow connects two nodes of the graph and that the nodes'
     * incoming/outgoing lists agree with the flows.
     *
     * @throws MalformedGraphException on the first inconsistency found
     */
    public static void validate(ProcessGraph graph) {
        for (SequenceFlow flow : graph.flowsById().values()) {
            FlowNode source = graph.nodesById().get(flow.sourceRef());
            FlowNode target = graph.nodesById().get(flow.targetRef());
            if (source == null) {
                throw new MalformedGraphException(String.format(
                        "Sequence flow '%s' references unknown source node '%s'", flow.id(), flow.sourceRef()));
            }
            if (target == null) {
                throw new MalformedGraphException(String.format(
                        "Sequence flow '%s' references unknown target node '%s'", flow.id(), flow.targetRef()));
            }
            if (!source.outgoingFlowIds().contains(flow.id())) {
                throw new MalformedGraphException(String.format(
                        "Node '%s' does not list sequence flow '%s' as outgoing", source.id(), flow.id()));
            }
            if (!target.incomingFlowIds().contains(flow.id())) {
                throw new MalformedGraphException(String.format(
                        "Node '%s' does not list sequence flow '%s' as incoming", target.id(), flow.id()));
            }
        }

        for (FlowNode node : graph.nodesById().values()) {
            for (String flowId : node.incomingFlowIds()) {
                SequenceFlow flow = graph.flowsById().get(flowId);
                if (flow == null || !flow.targetRef().equals(node.id())) {
                    throw new MalformedGraphException(String.format(
                            "Node '%s' lists incoming sequence flow '%s' that does not end there", node.id(), flowId));
                }
            }
            for (String flowId : node.outgoingFlowIds()) {
                SequenceFlow flow = graph.flowsById().get(flowId);
                if (flow == null || !flow.sourceRef().equals(node.id())) {
                    throw new MalformedGraphException(String.format(
                            "Node '%s' lists outgoing sequence flow '%s' that does not start there", node.id(), flowId));
                }
            }
        }
    }

    private static List<String> append(List<String> ids, String id) {
        List<String> copy = new ArrayList<>(ids);
        copy.add(id);
        return copy;
    }

    private static List<String> without(List<String> ids, String id) {
        List<String> copy = new ArrayList<>(ids);
        copy.remove(id);
        return copy;
    }

    private static String generateId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }
}
