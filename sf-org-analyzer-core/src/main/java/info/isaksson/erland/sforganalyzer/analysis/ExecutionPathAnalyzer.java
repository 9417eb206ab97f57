package info.isaksson.erland.sforganalyzer.analysis;

import info.isaksson.erland.sforganalyzer.config.ExecutionOptions;
import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.graph.ActionRef;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.EdgeKind;
import info.isaksson.erland.sforganalyzer.graph.ExecutionGraph;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.graph.GraphEdge;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.graph.StopReason;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Bounded depth-first enumeration of execution paths.
 *
 * <p>The analyzer first materializes the graph: every node passing the automation gates goes into the node
 * table, and every targeted action becomes an edge in declaration order. Targets missing from the table
 * become dangling edges with an unresolved-reference diagnostic. It then walks from each selected entry
 * point in identifier order.</p>
 *
 * <p>The visited set is per path, so a node reachable along two routes is explored along both. A path stops
 * at a leaf, at an edge back into the current path ({@code recursion}), at {@code maxDepth} edges while the
 * node still has successors, or when the run-wide iteration budget is spent. Each edge traversal costs one
 * iteration. Bounds close paths as truncated and never fail the run.</p>
 *
 * <p>The analyzer is stateless between runs and single-threaded within one, which keeps path order
 * reproducible.</p>
 */
public final class ExecutionPathAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionPathAnalyzer.class);

    private final ExecutionOptions options;

    /** @throws info.isaksson.erland.sforganalyzer.config.InvalidConfigurationException for invalid bounds */
    public ExecutionPathAnalyzer(ExecutionOptions options) {
        this.options = (options == null ? ExecutionOptions.defaults() : options).validate();
    }

    public AnalysisResult analyzeAll(Collection<AutomationNode> nodes) {
        return analyze(nodes, EntrySelection.all());
    }

    /** Paths from every entry point whose target object is {@code object}, in all trigger contexts. */
    public AnalysisResult analyzeObject(Collection<AutomationNode> nodes, String object) {
        return analyze(nodes, EntrySelection.forObject(object));
    }

    public AnalysisResult analyzeContext(Collection<AutomationNode> nodes, String object, TriggerContext context) {
        return analyze(nodes, EntrySelection.forContext(object, context));
    }

    /**
     * @throws IllegalArgumentException if an explicitly named entry is not in the node table
     */
    public AnalysisResult analyze(Collection<AutomationNode> nodes, EntrySelection selection) {
        EntrySelection sel = selection == null ? EntrySelection.all() : selection;
        Diagnostics diagnostics = new Diagnostics();
        ExecutionGraph graph = buildGraph(nodes, sel, diagnostics);

        TraversalContext ctx = new TraversalContext(options.maxDepth, options.maxIterations);
        List<ExecutionPath> paths = new ArrayList<>();
        for (String entry : graph.entryPoints) {
            Set<String> onPath = new HashSet<>();
            onPath.add(entry);
            walk(graph, entry, entry, new ArrayDeque<>(), onPath, ctx, paths);
        }

        Findings findings = new Findings(graph, options.trackSharing);
        paths.forEach(findings::inspect);

        long truncated = paths.stream().filter(p -> p.truncated).count();
        long recursive = paths.stream().filter(p -> p.recursion).count();
        logger.info("Analyzed {}: {} entry points, {} paths ({} truncated, {} recursive), {} iterations",
                sel, graph.entryPoints.size(), paths.size(), truncated, recursive, ctx.used());
        if (ctx.exhausted()) {
            logger.warn("Iteration limit {} reached; remaining paths were closed as truncated", options.maxIterations);
        }

        return new AnalysisResult(sel.toString(), graph, paths, findings.crossObject(), findings.summaries(),
                findings.risks(), findings.sharing(), countEntries(graph), ctx.used(), ctx.exhausted(),
                diagnostics.sorted());
    }

    // ---- graph materialization ----

    private ExecutionGraph buildGraph(Collection<AutomationNode> nodes, EntrySelection sel, Diagnostics diagnostics) {
        Map<String, AutomationNode> table = new LinkedHashMap<>();
        for (AutomationNode n : nodes == null ? List.<AutomationNode>of() : nodes) {
            if (!included(n.kind)) continue;
            AutomationNode node = n.kind == AutomationKind.APEX_METHOD && !options.followApex ? n.withoutActions() : n;
            table.putIfAbsent(node.id, node.withEntryPoint(sel.selects(node)));
        }
        for (String id : sel.explicitIds) {
            if (!table.containsKey(id)) throw new IllegalArgumentException("Unknown entry point: " + id);
        }

        List<GraphEdge> edges = new ArrayList<>();
        List<GraphEdge> dangling = new ArrayList<>();
        Set<String> targeted = new HashSet<>();
        for (AutomationNode n : table.values()) {
            for (ActionRef a : n.actions) {
                if (!a.hasTarget()) continue;
                AutomationKind targetKind = kindOrNull(a.targetId);
                if (targetKind != null && !included(targetKind)) {
                    logger.debug("Skipping {} -> {}: automation kind excluded", n.id, a.targetId);
                    continue;
                }
                AutomationNode target = table.get(a.targetId);
                if (target == null) {
                    dangling.add(new GraphEdge(n.id, a.targetId, EdgeKind.forAction(a.kind), a.description));
                    diagnostics.unresolved(n.file, n.line, n.name + " references " + a.targetId + " which was not found");
                    logger.warn("Unresolved reference from {} to {}", n.id, a.targetId);
                    continue;
                }
                edges.add(new GraphEdge(n.id, target.id, EdgeKind.toward(target.kind), a.description));
                targeted.add(target.id);
            }
        }

        ExecutionGraph.Builder b = ExecutionGraph.builder();
        for (AutomationNode n : table.values()) {
            // Leaves of gated-out or leaf-ified owners would be unreachable clutter.
            if (n.kind.isLeaf() && !n.entryPoint && !targeted.contains(n.id)) continue;
            b.addNode(n);
        }
        edges.forEach(b::addEdge);
        dangling.forEach(b::addDanglingEdge);
        return b.build();
    }

    private boolean included(AutomationKind kind) {
        return switch (kind) {
            case FLOW -> options.includeFlows;
            case PROCESS_BUILDER -> options.includeProcessBuilder;
            case WORKFLOW_RULE -> options.includeWorkflow;
            case TRIGGER, APEX_METHOD, DML_OPERATION, SOQL_QUERY -> true;
        };
    }

    private static AutomationKind kindOrNull(String id) {
        try {
            return NodeIds.kindOf(id);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // ---- traversal ----

    private void walk(ExecutionGraph graph, String entry, String nodeId, Deque<GraphEdge> path, Set<String> onPath,
                      TraversalContext ctx, List<ExecutionPath> out) {
        List<GraphEdge> outgoing = graph.outgoing(nodeId);
        if (outgoing.isEmpty()) {
            out.add(close(entry, path, false, false, StopReason.LEAF));
            return;
        }
        if (path.size() >= ctx.maxDepth) {
            logger.debug("Depth {} reached at {}", ctx.maxDepth, nodeId);
            out.add(close(entry, path, false, true, StopReason.MAX_DEPTH));
            return;
        }
        for (GraphEdge e : outgoing) {
            if (!ctx.tryAdvance()) {
                out.add(close(entry, path, false, true, StopReason.MAX_ITERATIONS));
                return;
            }
            path.addLast(e);
            if (onPath.contains(e.to)) {
                logger.debug("Cycle closed at {} on a path from {}", e.to, entry);
                out.add(close(entry, path, true, false, StopReason.CYCLE));
            } else {
                onPath.add(e.to);
                walk(graph, entry, e.to, path, onPath, ctx, out);
                onPath.remove(e.to);
            }
            path.removeLast();
        }
    }

    private static ExecutionPath close(String entry, Deque<GraphEdge> path, boolean recursion, boolean truncated,
                                       StopReason reason) {
        return new ExecutionPath(entry, new ArrayList<>(path), recursion, truncated, reason);
    }

    private static Map<String, Integer> countEntries(ExecutionGraph graph) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String id : graph.entryPoints) {
            graph.node(id).ifPresent(n -> counts.merge(n.kind.idPrefix(), 1, Integer::sum));
        }
        return counts;
    }

    // ---- per-path findings ----

    private static final class Findings {
        private final ExecutionGraph graph;
        private final boolean trackSharing;
        private final Set<CrossObjectDependency> crossObject = new LinkedHashSet<>();
        private final Set<RecursionRisk> risks = new LinkedHashSet<>();
        private final Set<SharingNotice> sharing = new LinkedHashSet<>();

        Findings(ExecutionGraph graph, boolean trackSharing) {
            this.graph = graph;
            this.trackSharing = trackSharing;
        }

        void inspect(ExecutionPath path) {
            AutomationNode entry = graph.node(path.entryId).orElseThrow();
            String entryObject = entry.targetObject;

            if (path.recursion) {
                risks.add(RecursionRisk.cycle(path.entryId, path.nodeIds(), entryObject));
            }
            for (GraphEdge e : path.edges) {
                AutomationNode target = graph.node(e.to).orElseThrow();
                if (target.kind.isLeaf() && !entryObject.isEmpty()) {
                    for (String object : target.touchedObjects()) {
                        if ("Unknown".equals(object)) continue;
                        if (object.equalsIgnoreCase(entryObject)) {
                            if (target.kind == AutomationKind.DML_OPERATION) {
                                risks.add(RecursionRisk.selfDml(path.entryId, List.of(path.entryId, target.id),
                                        entryObject, target.attribute("operation")));
                            }
                        } else {
                            crossObject.add(new CrossObjectDependency(path.entryId, entryObject, object, target.id, e.kind));
                        }
                    }
                }
                if (trackSharing && target.kind == AutomationKind.APEX_METHOD) {
                    String mode = target.attribute("sharing");
                    if ("without sharing".equals(mode) || "none".equals(mode)) {
                        String why = "none".equals(mode) ? "declares no sharing mode" : "runs without sharing";
                        sharing.add(new SharingNotice(path.entryId, target.id, mode,
                                path.entryId + " reaches " + target.name + " which " + why));
                    }
                }
            }
        }

        List<CrossObjectDependency> crossObject() {
            return new ArrayList<>(crossObject);
        }

        List<RecursionRisk> risks() {
            return new ArrayList<>(risks);
        }

        List<SharingNotice> sharing() {
            return new ArrayList<>(sharing);
        }

        List<ObjectDependencySummary> summaries() {
            Map<String, TreeSet<String>> entries = new TreeMap<>();
            Map<String, TreeSet<String>> touched = new TreeMap<>();
            for (String id : graph.entryPoints) {
                AutomationNode n = graph.node(id).orElseThrow();
                if (n.targetObject.isEmpty()) continue;
                entries.computeIfAbsent(n.targetObject, k -> new TreeSet<>()).add(id);
                touched.computeIfAbsent(n.targetObject, k -> new TreeSet<>());
            }
            for (CrossObjectDependency d : crossObject) {
                touched.computeIfAbsent(d.sourceObject, k -> new TreeSet<>()).add(d.targetObject);
            }
            List<ObjectDependencySummary> out = new ArrayList<>();
            for (Map.Entry<String, TreeSet<String>> e : entries.entrySet()) {
                out.add(new ObjectDependencySummary(e.getKey(), new ArrayList<>(e.getValue()),
                        new ArrayList<>(touched.get(e.getKey()))));
            }
            return out;
        }
    }
}
