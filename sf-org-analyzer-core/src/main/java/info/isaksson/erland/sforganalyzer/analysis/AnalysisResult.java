package info.isaksson.erland.sforganalyzer.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.graph.ExecutionGraph;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Everything one analyzer run produced. Immutable and serializable; {@code paths} are in enumeration order.
 */
@JsonPropertyOrder({"selection","graph","paths","crossObjectDependencies","objectDependencies","recursionRisks",
        "sharingNotices","automationCounts","iterationsUsed","iterationLimitReached","diagnostics"})
public final class AnalysisResult {
    public final String selection;
    public final ExecutionGraph graph;
    public final List<ExecutionPath> paths;
    public final List<CrossObjectDependency> crossObjectDependencies;
    public final List<ObjectDependencySummary> objectDependencies;
    public final List<RecursionRisk> recursionRisks;
    public final List<SharingNotice> sharingNotices;

    /** Entry points per automation kind, keyed by the kind's identifier prefix. */
    public final SortedMap<String, Integer> automationCounts;

    public final int iterationsUsed;
    public final boolean iterationLimitReached;
    public final List<Diagnostic> diagnostics;

    @JsonCreator
    public AnalysisResult(
            @JsonProperty("selection") String selection,
            @JsonProperty("graph") ExecutionGraph graph,
            @JsonProperty("paths") List<ExecutionPath> paths,
            @JsonProperty("crossObjectDependencies") List<CrossObjectDependency> crossObjectDependencies,
            @JsonProperty("objectDependencies") List<ObjectDependencySummary> objectDependencies,
            @JsonProperty("recursionRisks") List<RecursionRisk> recursionRisks,
            @JsonProperty("sharingNotices") List<SharingNotice> sharingNotices,
            @JsonProperty("automationCounts") Map<String, Integer> automationCounts,
            @JsonProperty("iterationsUsed") int iterationsUsed,
            @JsonProperty("iterationLimitReached") boolean iterationLimitReached,
            @JsonProperty("diagnostics") List<Diagnostic> diagnostics
    ) {
        this.selection = selection;
        this.graph = graph;
        this.paths = paths == null ? List.of() : List.copyOf(paths);
        this.crossObjectDependencies = crossObjectDependencies == null ? List.of() : List.copyOf(crossObjectDependencies);
        this.objectDependencies = objectDependencies == null ? List.of() : List.copyOf(objectDependencies);
        this.recursionRisks = recursionRisks == null ? List.of() : List.copyOf(recursionRisks);
        this.sharingNotices = sharingNotices == null ? List.of() : List.copyOf(sharingNotices);
        this.automationCounts = automationCounts == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(automationCounts));
        this.iterationsUsed = iterationsUsed;
        this.iterationLimitReached = iterationLimitReached;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /** Paths whose entry node runs in the given trigger context. */
    public List<ExecutionPath> pathsForContext(TriggerContext context) {
        return paths.stream()
                .filter(p -> graph.node(p.entryId).map(n -> n.triggerContext == context).orElse(false))
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public long truncatedPathCount() {
        return paths.stream().filter(p -> p.truncated).count();
    }

    @JsonIgnore
    public boolean hasRecursionRisks() {
        return !recursionRisks.isEmpty();
    }
}
