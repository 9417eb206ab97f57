package info.isaksson.erland.sforganalyzer.diagram;

import info.isaksson.erland.sforganalyzer.emitter.EmitterWarning;
import info.isaksson.erland.sforganalyzer.emitter.EmitterWarnings;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.EdgeKind;
import info.isaksson.erland.sforganalyzer.graph.ExecutionGraph;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.graph.GraphEdge;
import info.isaksson.erland.sforganalyzer.graph.StopReason;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class GraphSerializerTest {

    static final String T = "trigger:Account:T.beforeInsert";
    static final String A = "apex:AccountService:run";
    static final String D = "dml:Account:apex.AccountService.run#1";
    static final String Q = "soql:Contact:apex.AccountService.run#1";
    static final String F = "flow:Account:F";
    static final String G = "flow:Account:G";
    static final String MISSING = "apex:Missing:run";

    static ExecutionGraph graph() {
        ExecutionGraph.Builder b = ExecutionGraph.builder();
        b.addNode(AutomationNode.builder(T, AutomationKind.TRIGGER).name("T").targetObject("Account")
                .triggerContext(TriggerContext.BEFORE_INSERT).entryPoint(true).build());
        b.addNode(AutomationNode.builder(A, AutomationKind.APEX_METHOD).name("AccountService.run").build());
        b.addNode(AutomationNode.builder(D, AutomationKind.DML_OPERATION).name("update Account")
                .attribute("operation", "update").build());
        b.addNode(AutomationNode.builder(Q, AutomationKind.SOQL_QUERY).name("SELECT Id FROM Contact").build());
        b.addNode(AutomationNode.builder(F, AutomationKind.FLOW).name("F").targetObject("Account")
                .condition("Rating = 'Hot'").entryPoint(true).build());
        b.addNode(AutomationNode.builder(G, AutomationKind.FLOW).name("G").targetObject("Account").build());
        b.addEdge(new GraphEdge(T, A, EdgeKind.INVOKES, "AccountService.run()"));
        b.addEdge(new GraphEdge(A, D, EdgeKind.PERFORMS_DML, "update Account"));
        b.addEdge(new GraphEdge(A, Q, EdgeKind.PERFORMS_SOQL, "SOQL Contact"));
        b.addEdge(new GraphEdge(F, G, EdgeKind.FIRES, "fire G"));
        b.addDanglingEdge(new GraphEdge(T, MISSING, EdgeKind.INVOKES, "Missing.run()"));
        return b.build();
    }

    @Test
    void wholeGraphIsDeclaredInDiscoveryOrderWithLabels() {
        EmitterWarnings warnings = new EmitterWarnings();
        DiagramDocument doc = new GraphSerializer(VisualizationOptions.defaults()).serialize("all", graph(), warnings);

        assertEquals(List.of(F, G, T, A, D, Q, MISSING), ids(doc));
        assertEquals(List.of(
                        new DiagramEdge(F, G, "Rating = 'Hot'"),
                        new DiagramEdge(T, A, "before insert"),
                        new DiagramEdge(T, MISSING, "Missing.run()"),
                        new DiagramEdge(A, D, "update"),
                        new DiagramEdge(A, Q, "SOQL")),
                doc.edges);

        DiagramNode flow = doc.nodes.get(0);
        assertEquals("F\n(flow)\nConditions: Rating = 'Hot'", flow.label);
        assertEquals("flow", flow.styleClass);
        assertEquals(GraphSerializer.UNRESOLVED_STYLE, doc.nodes.get(6).styleClass);

        assertEquals(List.of("trigger", "flow", "apex", "dml", "soql", "unresolved"), List.copyOf(doc.styles.keySet()));
        assertEquals("#f96", doc.styles.get("trigger"));

        List<EmitterWarning> w = warnings.toDeterministicList();
        assertEquals(1, w.size());
        assertEquals("UNRESOLVED_TARGET", w.get(0).code);
        assertEquals(MISSING, w.get(0).context.get("to"));
    }

    @Test
    void optionsHideLeavesAndConditions() {
        VisualizationOptions o = new VisualizationOptions();
        o.showDmlOperations = false;
        o.showSoqlQueries = false;
        o.includeConditions = false;

        DiagramDocument doc = new GraphSerializer(o).serialize("all", graph(), null);

        assertEquals(List.of(F, G, T, A, MISSING), ids(doc));
        assertEquals("F\n(flow)", doc.nodes.get(0).label);
        assertNull(doc.edges.get(0).label);
        assertTrue(doc.edges.stream().noneMatch(e -> e.to.equals(D) || e.to.equals(Q)));
        assertFalse(doc.styles.containsKey("dml"));
    }

    @Test
    void pathsSelectTheirNodesAndMarkTruncation() {
        ExecutionGraph g = graph();
        ExecutionPath toDml = new ExecutionPath(T, List.of(g.outgoing(T).get(0), g.outgoing(A).get(0)),
                false, false, StopReason.LEAF);
        ExecutionPath cut = new ExecutionPath(T, List.of(g.outgoing(T).get(0)), false, true, StopReason.MAX_DEPTH);

        DiagramDocument doc = new GraphSerializer(null).serializePaths("T", g, List.of(toDml, cut), new EmitterWarnings());

        assertEquals(List.of(T, A, D, "truncated:" + A, MISSING), ids(doc));
        DiagramNode marker = doc.nodes.get(3);
        assertEquals("truncated\n(max depth)", marker.label);
        assertEquals(GraphSerializer.TRUNCATED_STYLE, marker.styleClass);
        assertEquals(4, doc.edges.size());
        assertEquals(new DiagramEdge(A, "truncated:" + A, null), doc.edges.get(2));
        assertTrue(doc.nodes.stream().noneMatch(n -> n.id.equals(F)));
    }

    @Test
    void nothingToDrawIsAWarningNotAnError() {
        EmitterWarnings warnings = new EmitterWarnings();
        DiagramDocument doc = new GraphSerializer(null)
                .serializePaths("none", graph(), List.of(), warnings);

        assertTrue(doc.nodes.isEmpty());
        assertTrue(doc.styles.isEmpty());
        assertEquals(List.of("EMPTY_DIAGRAM"),
                warnings.toDeterministicList().stream().map(w -> w.code).collect(Collectors.toList()));
    }

    private static List<String> ids(DiagramDocument doc) {
        return doc.nodes.stream().map(n -> n.id).collect(Collectors.toList());
    }
}
