package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Node table keyed by identifier plus a separate edge list.
 *
 * <p>Every edge in {@link #edges} connects two nodes of the table. References whose target is missing are
 * kept apart in {@link #danglingEdges} so that invariant holds. Cycles are allowed. Instances are immutable;
 * use {@link Builder} to assemble one.</p>
 */
@JsonPropertyOrder({"nodes","edges","danglingEdges","entryPoints"})
public final class ExecutionGraph {
    public final List<AutomationNode> nodes;
    public final List<GraphEdge> edges;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<GraphEdge> danglingEdges;

    public final List<String> entryPoints;

    @JsonIgnore
    private final Map<String, AutomationNode> byId;

    @JsonIgnore
    private final Map<String, List<GraphEdge>> outgoing;

    @JsonCreator
    public ExecutionGraph(
            @JsonProperty("nodes") List<AutomationNode> nodes,
            @JsonProperty("edges") List<GraphEdge> edges,
            @JsonProperty("danglingEdges") List<GraphEdge> danglingEdges,
            @JsonProperty("entryPoints") List<String> entryPoints
    ) {
        Map<String, AutomationNode> table = new TreeMap<>();
        for (AutomationNode n : nodes == null ? List.<AutomationNode>of() : nodes) {
            if (table.putIfAbsent(n.id, n) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + n.id);
            }
        }
        Map<String, List<GraphEdge>> out = new LinkedHashMap<>();
        for (GraphEdge e : edges == null ? List.<GraphEdge>of() : edges) {
            if (!table.containsKey(e.from) || !table.containsKey(e.to)) {
                throw new IllegalArgumentException("Edge endpoint missing from node table: " + e);
            }
            out.computeIfAbsent(e.from, k -> new ArrayList<>()).add(e);
        }
        TreeSet<String> entries = new TreeSet<>(entryPoints == null ? List.of() : entryPoints);
        for (String id : entries) {
            if (!table.containsKey(id)) throw new IllegalArgumentException("Entry point not in node table: " + id);
        }

        this.nodes = List.copyOf(table.values());
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.danglingEdges = danglingEdges == null ? List.of() : List.copyOf(danglingEdges);
        this.entryPoints = List.copyOf(entries);
        this.byId = Collections.unmodifiableMap(table);
        Map<String, List<GraphEdge>> frozen = new LinkedHashMap<>();
        out.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.outgoing = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<AutomationNode> node(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /** Outgoing edges of a node, in the order they were recorded. */
    public List<GraphEdge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /**
     * Single-writer builder. Nodes keep the first registration for an id; edges keep insertion order.
     */
    public static final class Builder {
        private final Map<String, AutomationNode> nodes = new LinkedHashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        private final List<GraphEdge> dangling = new ArrayList<>();
        private final TreeSet<String> entries = new TreeSet<>();

        private Builder() {}

        /** @return false if a node with the same id is already registered */
        public boolean addNode(AutomationNode node) {
            if (nodes.containsKey(node.id)) return false;
            nodes.put(node.id, node);
            if (node.entryPoint) entries.add(node.id);
            return true;
        }

        public Optional<AutomationNode> node(String id) {
            return Optional.ofNullable(nodes.get(id));
        }

        public Builder markEntryPoint(String id) {
            AutomationNode n = nodes.get(id);
            if (n == null) throw new IllegalArgumentException("Unknown entry point: " + id);
            nodes.put(id, n.withEntryPoint(true));
            entries.add(id);
            return this;
        }

        public Builder addEdge(GraphEdge edge) {
            if (!nodes.containsKey(edge.from) || !nodes.containsKey(edge.to)) {
                throw new IllegalArgumentException("Edge endpoint missing from node table: " + edge);
            }
            edges.add(edge);
            return this;
        }

        public Builder addDanglingEdge(GraphEdge edge) {
            dangling.add(edge);
            return this;
        }

        public ExecutionGraph build() {
            return new ExecutionGraph(new ArrayList<>(nodes.values()), edges, dangling, new ArrayList<>(entries));
        }
    }
}
