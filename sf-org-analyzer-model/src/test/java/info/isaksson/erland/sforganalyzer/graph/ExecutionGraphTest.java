package info.isaksson.erland.sforganalyzer.graph;

import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionGraphTest {

    @Test
    void edgesRequireBothEndpoints() {
        ExecutionGraph.Builder b = ExecutionGraph.builder();
        b.addNode(node(NodeIds.flow("Account", "A"), AutomationKind.FLOW));

        assertThrows(IllegalArgumentException.class,
                () -> b.addEdge(new GraphEdge("flow:Account:A", "flow:Account:B", EdgeKind.FIRES, null)));

        b.addDanglingEdge(new GraphEdge("flow:Account:A", "flow:Account:B", EdgeKind.FIRES, null));
        ExecutionGraph g = b.build();
        assertTrue(g.edges.isEmpty());
        assertEquals(1, g.danglingEdges.size());
    }

    @Test
    void duplicateNodeKeepsFirstRegistration() {
        ExecutionGraph.Builder b = ExecutionGraph.builder();
        assertTrue(b.addNode(AutomationNode.builder("flow:Account:A", AutomationKind.FLOW).name("first").build()));
        assertFalse(b.addNode(AutomationNode.builder("flow:Account:A", AutomationKind.FLOW).name("second").build()));
        assertEquals("first", b.build().node("flow:Account:A").orElseThrow().name);
    }

    @Test
    void selfLoopIsAllowedAndOutgoingKeepsInsertionOrder() {
        String a = NodeIds.flow("Account", "A");
        String x = NodeIds.apexMethod("Svc", "x");
        String y = NodeIds.apexMethod("Svc", "y");
        ExecutionGraph.Builder b = ExecutionGraph.builder();
        b.addNode(node(a, AutomationKind.FLOW));
        b.addNode(node(y, AutomationKind.APEX_METHOD));
        b.addNode(node(x, AutomationKind.APEX_METHOD));
        b.addEdge(new GraphEdge(a, y, EdgeKind.INVOKES, null));
        b.addEdge(new GraphEdge(a, x, EdgeKind.INVOKES, null));
        b.addEdge(new GraphEdge(a, a, EdgeKind.FIRES, null));
        b.markEntryPoint(a);
        ExecutionGraph graph = b.build();

        assertEquals(3, graph.outgoing(a).size());
        assertEquals(y, graph.outgoing(a).get(0).to);
        assertEquals(a, graph.outgoing(a).get(2).to);
        assertTrue(graph.node(a).orElseThrow().entryPoint);
        assertEquals(List.of(a), graph.entryPoints);
    }

    @Test
    void triggerIdsCarryContextSuffix() {
        assertEquals("trigger:Account:AccountTrigger.beforeInsert",
                NodeIds.trigger("Account", "AccountTrigger", TriggerContext.BEFORE_INSERT));
        assertEquals(AutomationKind.TRIGGER, NodeIds.kindOf("trigger:Account:AccountTrigger.beforeInsert"));
        assertEquals("dml:Account:apex.AccountService.save#1",
                NodeIds.dml("Account", AutomationKind.APEX_METHOD, "AccountService.save", 1));
    }

    @Test
    void leafNodesDropActions() {
        AutomationNode leaf = AutomationNode.builder("dml:Account:S.m#1", AutomationKind.DML_OPERATION)
                .action(ActionRef.fire("flow:Account:A", ""))
                .build();
        assertTrue(leaf.actions.isEmpty());
        assertEquals(EdgeKind.PERFORMS_DML, EdgeKind.toward(leaf.kind));
    }

    private static AutomationNode node(String id, AutomationKind kind) {
        return AutomationNode.builder(id, kind).name(id).targetObject("Account").build();
    }
}
