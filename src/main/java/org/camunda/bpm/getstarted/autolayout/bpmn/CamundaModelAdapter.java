package org.camunda.bpm.getstarted.autolayout.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.NodeType;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.autolayout.layout.BpmnDiagramLayouter;
import org.camunda.bpm.getstarted.autolayout.layout.models.LayoutResult;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.BaseElement;
import org.camunda.bpm.model.bpmn.instance.Definitions;
import org.camunda.bpm.model.bpmn.instance.FlowElement;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnDiagram;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnEdge;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnPlane;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnShape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bridges Camunda's BPMN model API and the layouter's process graph: reads the
 * flow nodes and sequence flows of a process and writes the computed layout back
 * as BPMN Diagram Interchange shapes and edges.
 */
@Slf4j
public class CamundaModelAdapter {

    private CamundaModelAdapter() {
    }

    /**
     * Converts the first process of the model.
     *
     * @throws IllegalArgumentException if the model has no process
     */
    public static ProcessGraph toProcessGraph(BpmnModelInstance modelInstance) {
        Collection<Process> processes = modelInstance.getModelElementsByType(Process.class);
        if (processes.isEmpty()) {
            throw new IllegalArgumentException("BPMN model does not contain a process");
        }
        return toProcessGraph(processes.iterator().next());
    }

    /**
     * Converts the direct flow nodes and sequence flows of a process, in document order.
     * Nodes of unsupported kinds (e.g. call activities) are skipped together with their flows.
     */
    public static ProcessGraph toProcessGraph(Process process) {
        ProcessGraph graph = new ProcessGraph(process.getId(), process.getName() == null ? "" : process.getName());
        List<org.camunda.bpm.model.bpmn.instance.SequenceFlow> sequenceFlows = new ArrayList<>();

        for (FlowElement element : process.getFlowElements()) {
            if (element instanceof org.camunda.bpm.model.bpmn.instance.SequenceFlow sequenceFlow) {
                sequenceFlows.add(sequenceFlow);
            } else if (element instanceof org.camunda.bpm.model.bpmn.instance.FlowNode flowNode) {
                String typeName = flowNode.getElementType().getTypeName();
                NodeType type;
                try {
                    type = NodeType.fromBpmnName(typeName);
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping flow node {}: {}", flowNode.getId(), e.getMessage());
                    continue;
                }
                ProcessGraphHelper.addFlowNode(graph, flowNode.getId(), type, flowNode.getName());
            }
        }

        for (org.camunda.bpm.model.bpmn.instance.SequenceFlow sequenceFlow : sequenceFlows) {
            String sourceId = sequenceFlow.getSource().getId();
            String targetId = sequenceFlow.getTarget().getId();
            if (!graph.nodesById().containsKey(sourceId) || !graph.nodesById().containsKey(targetId)) {
                log.warn("Skipping sequence flow {} connected to a skipped node", sequenceFlow.getId());
                continue;
            }
            ProcessGraphHelper.addSequenceFlow(graph, sequenceFlow.getId(), sourceId, targetId, sequenceFlow.getName());
        }
        return graph;
    }

    /**
     * Replaces the diagram of the graph's process with one shape per laid out node
     * and one edge per routed flow.
     *
     * @throws IllegalArgumentException if the model has no process with the graph's id
     * @throws IllegalStateException    if the graph has not been laid out
     */
    public static void applyLayout(BpmnModelInstance modelInstance, ProcessGraph graph) {
        BaseElement processElement = modelInstance.getModelElementById(graph.id());
        if (!(processElement instanceof Process process)) {
            throw new IllegalArgumentException("BPMN model has no process with id '" + graph.id() + "'");
        }

        Definitions definitions = modelInstance.getDefinitions();
        removeDiagramsOf(definitions, process);

        BpmnDiagram diagram = modelInstance.newInstance(BpmnDiagram.class, "BPMNDiagram_" + process.getId());
        BpmnPlane plane = modelInstance.newInstance(BpmnPlane.class, "BPMNPlane_" + process.getId());
        plane.setBpmnElement(process);
        diagram.setBpmnPlane(plane);
        definitions.addChildElement(diagram);

        for (FlowNode node : graph.nodesById().values()) {
            if (!node.isLaidOut()) {
                throw new IllegalStateException("Node '" + node.id() + "' has not been laid out");
            }
            BpmnShape shape = modelInstance.newInstance(BpmnShape.class, node.id() + "_di");
            shape.setBpmnElement(modelInstance.getModelElementById(node.id()));

            org.camunda.bpm.model.bpmn.instance.dc.Bounds bounds =
                    modelInstance.newInstance(org.camunda.bpm.model.bpmn.instance.dc.Bounds.class);
            bounds.setX(node.bounds().x());
            bounds.setY(node.bounds().y());
            bounds.setWidth(node.bounds().width());
            bounds.setHeight(node.bounds().height());
            shape.setBounds(bounds);
            plane.addChildElement(shape);
        }

        for (SequenceFlow flow : graph.flowsById().values()) {
            BpmnEdge edge = modelInstance.newInstance(BpmnEdge.class, flow.id() + "_di");
            edge.setBpmnElement(modelInstance.getModelElementById(flow.id()));
            for (org.camunda.bpm.getstarted.autolayout.bpmn.models.Waypoint point : flow.waypoints()) {
                org.camunda.bpm.model.bpmn.instance.di.Waypoint waypoint =
                        modelInstance.newInstance(org.camunda.bpm.model.bpmn.instance.di.Waypoint.class);
                waypoint.setX(point.x());
                waypoint.setY(point.y());
                edge.addChildElement(waypoint);
            }
            plane.addChildElement(edge);
        }
        log.debug("Wrote {} shapes and {} edges for process {}",
                graph.nodesById().size(), graph.flowsById().size(), process.getId());
    }

    /**
     * Converts the model's first process, lays it out and writes the diagram back.
     */
    public static LayoutResult layout(BpmnModelInstance modelInstance, LayoutConfig config) {
        ProcessGraph graph = toProcessGraph(modelInstance);
        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph, config);
        applyLayout(modelInstance, graph);
        return result;
    }

    private static void removeDiagramsOf(Definitions definitions, Process process) {
        Set<BpmnDiagram> stale = new HashSet<>();
        for (BpmnDiagram diagram : definitions.getBpmDiagrams()) {
            BpmnPlane plane = diagram.getBpmnPlane();
            if (plane == null || plane.getBpmnElement() == null || process.equals(plane.getBpmnElement())) {
                stale.add(diagram);
            }
        }
        stale.forEach(definitions::removeChildElement);
    }
}
