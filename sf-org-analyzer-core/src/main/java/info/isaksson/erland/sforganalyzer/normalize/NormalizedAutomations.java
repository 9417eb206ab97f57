package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;

import java.util.List;

/** Output of {@link AutomationNormalizer}: nodes in production order plus the problems found on the way. */
public final class NormalizedAutomations {
    public final List<AutomationNode> nodes;
    public final List<Diagnostic> diagnostics;

    public NormalizedAutomations(List<AutomationNode> nodes, List<Diagnostic> diagnostics) {
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public long count(AutomationKind kind) {
        return nodes.stream().filter(n -> n.kind == kind).count();
    }
}
