package org.camunda.bpm.getstarted.autolayout.layout;

import org.camunda.bpm.getstarted.autolayout.bpmn.ProcessGraphHelper;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Bounds;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.FlowNode;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.NodeType;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.ProcessGraph;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.SequenceFlow;
import org.camunda.bpm.getstarted.autolayout.bpmn.models.Waypoint;
import org.camunda.bpm.getstarted.autolayout.config.models.LayoutConfig;
import org.camunda.bpm.getstarted.autolayout.exceptions.CycleBreakFailureException;
import org.camunda.bpm.getstarted.autolayout.exceptions.LayoutException;
import org.camunda.bpm.getstarted.autolayout.exceptions.MalformedGraphException;
import org.camunda.bpm.getstarted.autolayout.layout.models.GridCell;
import org.camunda.bpm.getstarted.autolayout.layout.models.LayoutResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BpmnDiagramLayouterTest {

    private static void assertBounds(ProcessGraph graph, String nodeId, double x, double y) {
        FlowNode node = ProcessGraphHelper.getNodeById(graph, nodeId);
        assertEquals(new Bounds(x, y, 100, 100), node.bounds(), "bounds of " + nodeId);
    }

    private static boolean touches(Bounds bounds, Waypoint point) {
        return point.x() >= bounds.x() && point.x() <= bounds.right()
                && point.y() >= bounds.y() && point.y() <= bounds.bottom();
    }

    @Test
    void shouldLayOutLinearChain() {
        ProcessGraph graph = LayoutTestGraphs.linearChain();

        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph);

        assertEquals(List.of("start", "task", "end"), result.order());
        assertBounds(graph, "start", 200, 150);
        assertBounds(graph, "task", 350, 150);
        assertBounds(graph, "end", 500, 150);
        assertEquals(List.of(new Waypoint(300, 200), new Waypoint(350, 200)),
                ProcessGraphHelper.getFlowById(graph, "start_to_task").waypoints());

        FlowNode task = ProcessGraphHelper.getNodeById(graph, "task");
        assertEquals(1, task.row());
        assertEquals(2, task.column());
    }

    @Test
    void shouldLayOutSplitAndJoin() {
        ProcessGraph graph = LayoutTestGraphs.splitJoin();

        BpmnDiagramLayouter.generateLayout(graph);

        assertBounds(graph, "split", 500, 150);
        assertBounds(graph, "taskA", 650, 250);
        assertBounds(graph, "taskB", 650, 50);
        assertBounds(graph, "join", 800, 150);
        assertBounds(graph, "end", 950, 150);

        assertEquals(List.of(new Waypoint(550, 200), new Waypoint(550, 300), new Waypoint(650, 300)),
                ProcessGraphHelper.getFlowById(graph, "split_to_a").waypoints());
        assertEquals(List.of(new Waypoint(750, 300), new Waypoint(850, 300), new Waypoint(850, 250)),
                ProcessGraphHelper.getFlowById(graph, "a_to_join").waypoints());
    }

    @Test
    void shouldLayOutCycleAndReportBackwardFlow() {
        ProcessGraph graph = LayoutTestGraphs.simpleCycle();

        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph);

        assertEquals(Set.of("two_to_gateway"), result.backwardFlowIds());
        assertBounds(graph, "task1", 200, 150);
        assertBounds(graph, "gateway", 350, 150);
        assertBounds(graph, "task2", 500, 150);
        // backward flows are still routed
        assertFalse(ProcessGraphHelper.getFlowById(graph, "two_to_gateway").waypoints().isEmpty());
    }

    @Test
    void shouldRouteEveryFlowBetweenItsNodes() {
        ProcessGraph graph = LayoutTestGraphs.loopThroughGateways();

        BpmnDiagramLayouter.generateLayout(graph);

        for (SequenceFlow flow : graph.flowsById().values()) {
            List<Waypoint> waypoints = flow.waypoints();
            assertTrue(waypoints.size() >= 2, "too few waypoints on " + flow.id());
            Bounds source = ProcessGraphHelper.getNodeById(graph, flow.sourceRef()).bounds();
            Bounds target = ProcessGraphHelper.getNodeById(graph, flow.targetRef()).bounds();
            assertTrue(touches(source, waypoints.get(0)), "first waypoint off source on " + flow.id());
            assertTrue(touches(target, waypoints.get(waypoints.size() - 1)), "last waypoint off target on " + flow.id());
        }
    }

    @Test
    void shouldGiveEveryNodeItsOwnCell() {
        ProcessGraph graph = LayoutTestGraphs.fanOut(5);

        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph);

        Set<String> positions = new HashSet<>();
        for (FlowNode node : graph.nodesById().values()) {
            assertTrue(node.isLaidOut());
            assertTrue(positions.add(node.row() + ":" + node.column()), "shared cell at " + node.id());
            assertEquals(node.column() * 150.0 + 50, node.bounds().x());
            assertEquals(node.row() * 100.0 + 50, node.bounds().y());
        }
        assertEquals(graph.nodesById().size(), result.cells().size());
    }

    @Test
    void shouldProduceSameLayoutOnRepeatedRuns() {
        ProcessGraph first = LayoutTestGraphs.loopThroughGateways();
        ProcessGraph second = LayoutTestGraphs.loopThroughGateways();

        LayoutResult firstResult = BpmnDiagramLayouter.generateLayout(first);
        LayoutResult secondResult = BpmnDiagramLayouter.generateLayout(second);

        assertEquals(firstResult, secondResult);
        assertEquals(first.nodesById(), second.nodesById());
        assertEquals(first.flowsById(), second.flowsById());
    }

    @Test
    void shouldRelayOutAlreadyLaidOutGraph() {
        ProcessGraph graph = LayoutTestGraphs.splitJoin();
        LayoutResult first = BpmnDiagramLayouter.generateLayout(graph);

        LayoutResult second = BpmnDiagramLayouter.generateLayout(graph);

        assertEquals(first, second);
    }

    @Test
    void shouldApplyCustomConfig() {
        ProcessGraph graph = LayoutTestGraphs.linearChain();
        LayoutConfig config = new LayoutConfig(200, 120, 0, 1, 0, 50, 40, 0);

        BpmnDiagramLayouter.generateLayout(graph, config);

        assertEquals(new Bounds(0, 120, 50, 40), ProcessGraphHelper.getNodeById(graph, "start").bounds());
        assertEquals(new Bounds(200, 120, 50, 40), ProcessGraphHelper.getNodeById(graph, "task").bounds());
        assertEquals(List.of(new Waypoint(50, 140), new Waypoint(200, 140)),
                ProcessGraphHelper.getFlowById(graph, "start_to_task").waypoints());
    }

    @Test
    void shouldLayOutEmptyGraph() {
        ProcessGraph graph = new ProcessGraph("empty", "");

        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph);

        assertTrue(result.order().isEmpty());
        assertTrue(result.cells().isEmpty());
    }

    @Test
    void shouldRejectInconsistentGraph() {
        ProcessGraph graph = LayoutTestGraphs.linearChain();
        graph.flowsById().remove("task_to_end");

        assertThrows(MalformedGraphException.class, () -> BpmnDiagramLayouter.generateLayout(graph));
    }

    @Test
    void shouldLeaveGraphUntouchedWhenLayoutFails() {
        ProcessGraph graph = LayoutTestGraphs.linearChain();
        ProcessGraphHelper.addTask(graph, "a", "a");
        ProcessGraphHelper.addTask(graph, "b", "b");
        ProcessGraphHelper.addSequenceFlow(graph, "a_to_b", "a", "b");
        ProcessGraphHelper.addSequenceFlow(graph, "b_to_a", "b", "a");

        LayoutException e = assertThrows(LayoutException.class, () -> BpmnDiagramLayouter.generateLayout(graph));

        assertInstanceOf(CycleBreakFailureException.class, e);
        for (FlowNode node : graph.nodesById().values()) {
            assertNull(node.bounds(), "bounds written to " + node.id());
            assertNull(node.row());
        }
        for (SequenceFlow flow : graph.flowsById().values()) {
            assertTrue(flow.waypoints().isEmpty());
        }
    }

    @Test
    void shouldLayOutGraphBuiltFromUnmodifiableMaps() {
        FlowNode a = FlowNode.builder().id("a").type(NodeType.START_EVENT).outgoingFlowIds(List.of("a_to_b")).build();
        FlowNode b = FlowNode.builder().id("b").type(NodeType.END_EVENT).incomingFlowIds(List.of("a_to_b")).build();
        Map<String, FlowNode> nodes = Map.of("a", a, "b", b);
        Map<String, SequenceFlow> flows = Map.of("a_to_b", new SequenceFlow("a_to_b", "", "a", "b"));
        ProcessGraph graph = new ProcessGraph("immutable", "", nodes, flows);

        BpmnDiagramLayouter.generateLayout(graph);

        assertBounds(graph, "a", 200, 150);
        assertBounds(graph, "b", 350, 150);
        assertEquals(2, ProcessGraphHelper.getFlowById(graph, "a_to_b").waypoints().size());
        // the caller's maps are left alone
        assertNull(nodes.get("a").bounds());
    }

    @Test
    void shouldNotFailAcyclicGraphWhenIterationLimitIsTooLow() {
        ProcessGraph graph = LayoutTestGraphs.splitJoin();
        LayoutConfig config = new LayoutConfig(150, 100, 50, 1, 1, 100, 100, 1);

        LayoutResult result = BpmnDiagramLayouter.generateLayout(graph, config);

        assertEquals(7, result.order().size());
        assertTrue(result.backwardFlowIds().isEmpty());
    }

    @Test
    void shouldLookUpCellsByNodeId() {
        LayoutResult result = BpmnDiagramLayouter.generateLayout(LayoutTestGraphs.splitJoin());

        assertEquals(new GridCell(2, 4, "taskA"), result.cellOf("taskA"));
        assertEquals(new GridCell(1, 5, "join"), result.cellOf("join"));
        assertNull(result.cellOf("missing"));
        assertEquals(List.of("start", "task1", "split", "taskA", "taskB", "join", "end"),
                result.cells().stream().map(GridCell::nodeId).toList());
    }
}
