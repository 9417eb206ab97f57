package info.isaksson.erland.sforganalyzer.diagram;

import info.isaksson.erland.sforganalyzer.emitter.EmitterWarnings;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.ExecutionGraph;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.graph.GraphEdge;
import info.isaksson.erland.sforganalyzer.graph.StopReason;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns an execution graph, or a set of paths through it, into ordered diagram primitives.
 *
 * <p>Pure function of its input. Nodes are declared in discovery order from the entry points; edges follow
 * the order they were recorded in the graph. Dangling references become {@code unresolved} nodes, and each
 * truncated path ends in a {@code truncated} marker node.</p>
 */
public final class GraphSerializer {

    public static final String UNRESOLVED_STYLE = "unresolved";
    public static final String TRUNCATED_STYLE = "truncated";

    private static final String DEFAULT_FILL = "#fff";

    private final VisualizationOptions options;

    public GraphSerializer(VisualizationOptions options) {
        this.options = options == null ? VisualizationOptions.defaults() : options;
    }

    /** Every node and edge of the graph. Nodes unreachable from an entry point follow in id order. */
    public DiagramDocument serialize(String title, ExecutionGraph graph, EmitterWarnings warnings) {
        if (graph == null) throw new IllegalArgumentException("graph must not be null");
        Emission out = new Emission(graph, warnings);

        Set<String> seen = new LinkedHashSet<>();
        for (String entry : graph.entryPoints) discover(graph, entry, seen);
        for (AutomationNode n : graph.nodes) discover(graph, n.id, seen);

        for (String id : seen) out.node(id);
        for (String id : seen) {
            for (GraphEdge e : graph.outgoing(id)) out.edge(e);
            out.dangling(id);
        }
        return out.document(title);
    }

    /** Only the nodes and edges the given paths walk, in path order. */
    public DiagramDocument serializePaths(String title, ExecutionGraph graph, List<ExecutionPath> paths,
                                          EmitterWarnings warnings) {
        if (graph == null) throw new IllegalArgumentException("graph must not be null");
        Emission out = new Emission(graph, warnings);

        List<String> onPaths = new ArrayList<>();
        for (ExecutionPath p : paths == null ? List.<ExecutionPath>of() : paths) {
            out.node(p.entryId);
            onPaths.add(p.entryId);
            for (GraphEdge e : p.edges) {
                out.node(e.to);
                out.edge(e);
                onPaths.add(e.to);
            }
            if (p.truncated) out.truncated(p.lastNodeId(), p.stopReason);
        }
        for (String id : new LinkedHashSet<>(onPaths)) out.dangling(id);
        return out.document(title);
    }

    private void discover(ExecutionGraph graph, String id, Set<String> seen) {
        if (!seen.add(id)) return;
        for (GraphEdge e : graph.outgoing(id)) discover(graph, e.to, seen);
    }

    private boolean visible(AutomationNode n) {
        return switch (n.kind) {
            case DML_OPERATION -> options.showDmlOperations;
            case SOQL_QUERY -> options.showSoqlQueries;
            case TRIGGER, FLOW, PROCESS_BUILDER, WORKFLOW_RULE, APEX_METHOD -> true;
        };
    }

    String nodeLabel(AutomationNode n) {
        StringBuilder sb = new StringBuilder(n.name.isEmpty() ? n.id : n.name);
        sb.append('\n').append('(').append(n.kind.idPrefix()).append(')');
        if (options.includeConditions && !n.conditions.isEmpty()) {
            sb.append('\n').append("Conditions: ").append(String.join("; ", n.conditions));
        }
        return sb.toString();
    }

    String edgeLabel(AutomationNode from, AutomationNode to, GraphEdge e) {
        List<String> parts = new ArrayList<>();
        if (from.kind == AutomationKind.TRIGGER && from.triggerContext != null) {
            parts.add(from.triggerContext.label());
        }
        switch (e.kind) {
            case PERFORMS_DML -> {
                String op = to.attribute("operation");
                if (op != null) parts.add(op);
            }
            case PERFORMS_SOQL -> parts.add("SOQL");
            case FIRES -> {
                if (options.includeConditions && !from.conditions.isEmpty()) {
                    parts.add(String.join(" AND ", from.conditions));
                }
            }
            case INVOKES -> { }
        }
        return parts.isEmpty() ? null : String.join(": ", parts);
    }

    /** Accumulates primitives for one document, dropping repeats and hidden leaves. */
    private final class Emission {
        private final ExecutionGraph graph;
        private final EmitterWarnings warnings;
        private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
        private final List<DiagramEdge> edges = new ArrayList<>();
        private final Set<DiagramEdge> edgeSet = new HashSet<>();
        private final Set<String> danglingDone = new HashSet<>();

        Emission(ExecutionGraph graph, EmitterWarnings warnings) {
            this.graph = graph;
            this.warnings = warnings == null ? new EmitterWarnings() : warnings;
        }

        void node(String id) {
            if (nodes.containsKey(id)) return;
            graph.node(id).filter(GraphSerializer.this::visible)
                    .ifPresent(n -> nodes.put(id, new DiagramNode(id, nodeLabel(n), n.kind.idPrefix())));
        }

        void edge(GraphEdge e) {
            if (!nodes.containsKey(e.from) || !nodes.containsKey(e.to)) return;
            AutomationNode from = graph.node(e.from).orElseThrow();
            AutomationNode to = graph.node(e.to).orElseThrow();
            add(new DiagramEdge(e.from, e.to, edgeLabel(from, to, e)));
        }

        void dangling(String id) {
            if (!nodes.containsKey(id) || !danglingDone.add(id)) return;
            for (GraphEdge e : graph.danglingEdges) {
                if (!e.from.equals(id)) continue;
                nodes.computeIfAbsent(e.to, k -> new DiagramNode(k, k + "\n(unresolved)", UNRESOLVED_STYLE));
                add(new DiagramEdge(e.from, e.to, e.label));
                warnings.warn("UNRESOLVED_TARGET", "Edge target is not in the graph", "from", e.from, "to", e.to);
            }
        }

        void truncated(String lastId, StopReason reason) {
            if (!nodes.containsKey(lastId)) return;
            String markerId = TRUNCATED_STYLE + ":" + lastId;
            String why = reason == null ? "" : reason.name().toLowerCase(Locale.ROOT).replace('_', ' ');
            nodes.computeIfAbsent(markerId, k -> new DiagramNode(k, "truncated\n(" + why + ")", TRUNCATED_STYLE));
            add(new DiagramEdge(lastId, markerId, null));
        }

        private void add(DiagramEdge e) {
            if (edgeSet.add(e)) edges.add(e);
        }

        DiagramDocument document(String title) {
            if (nodes.isEmpty()) warnings.warn("EMPTY_DIAGRAM", "Nothing to draw");
            Set<String> used = new TreeSet<>();
            for (DiagramNode n : nodes.values()) used.add(n.styleClass);
            Map<String, String> styles = new LinkedHashMap<>();
            for (Map.Entry<String, String> s : options.styles.entrySet()) {
                if (used.remove(s.getKey())) styles.put(s.getKey(), s.getValue());
            }
            for (String rest : used) styles.put(rest, DEFAULT_FILL);
            return new DiagramDocument(title, new ArrayList<>(nodes.values()), edges, styles);
        }
    }
}
