package info.isaksson.erland.sforganalyzer.report;

import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.analysis.CrossObjectDependency;
import info.isaksson.erland.sforganalyzer.analysis.ObjectDependencySummary;
import info.isaksson.erland.sforganalyzer.analysis.RecursionRisk;
import info.isaksson.erland.sforganalyzer.analysis.SharingNotice;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerResult;
import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.emitter.DiagramEmitter;
import info.isaksson.erland.sforganalyzer.emitter.EmitterWarning;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report.
 *
 * NOTE: paths are listed in enumeration order; a path marked "truncated" hit a depth or iteration bound, so
 * automation beyond its last node was not explored.
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     Path sourcePath,
                                     Path metadataPath,
                                     OrgAnalyzerResult result,
                                     DiagramEmitter.Result diagram,
                                     List<String> excludes) throws IOException {
        Files.writeString(reportPath, toMarkdown(sourcePath, metadataPath, result, diagram, excludes),
                StandardCharsets.UTF_8);
    }

    public static String toMarkdown(Path sourcePath,
                                    Path metadataPath,
                                    OrgAnalyzerResult result,
                                    DiagramEmitter.Result diagram,
                                    List<String> excludes) {
        AnalysisResult a = result.analysis;
        StringBuilder report = new StringBuilder();
        report.append("# sf-org-analyzer report\n\n");

        report.append("## Summary\n\n");
        report.append("- Source: `").append(sourcePath).append("`\n");
        report.append("- Metadata: ").append(metadataPath == null ? "_(none)_" : "`" + metadataPath + "`").append("\n");
        report.append("- Selection: ").append(a.selection).append("\n");
        report.append("- Apex files parsed: **").append(result.filesParsed).append("**\n");
        report.append("- Apex classes: **").append(result.codebase.classes.size()).append("**\n");
        report.append("- Apex triggers: **").append(result.codebase.triggers.size()).append("**\n");
        report.append("- Automation nodes: **").append(result.automations.nodes.size()).append("**\n");
        report.append("- Execution paths: **").append(a.paths.size()).append("**\n");
        report.append("- Truncated paths: **").append(a.truncatedPathCount()).append("**\n");
        report.append("- Iterations used: **").append(a.iterationsUsed).append("**")
                .append(a.iterationLimitReached ? " (limit reached)" : "").append("\n");
        report.append("- Diagnostics: **").append(result.diagnostics.size()).append("**\n");
        report.append("- Excludes: ").append(excludes == null || excludes.isEmpty()
                ? "_(none)_" : "`" + String.join("`, `", excludes) + "`").append("\n\n");

        report.append("## Entry points by kind\n\n");
        if (a.automationCounts.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Kind | Entry points |\n");
            report.append("|---|---:|\n");
            for (Map.Entry<String, Integer> e : a.automationCounts.entrySet()) {
                report.append("| `").append(e.getKey()).append("` | ").append(e.getValue()).append(" |\n");
            }
        }

        report.append("\n## Execution paths\n\n");
        if (a.paths.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            int i = 1;
            for (ExecutionPath p : a.paths) {
                report.append(i++).append(". ").append(pathLine(p)).append("\n");
            }
        }

        report.append("\n## Recursion risks\n\n");
        if (a.recursionRisks.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (RecursionRisk r : a.recursionRisks) {
                report.append("- **").append(r.kind).append("** ").append(r.message).append("\n");
            }
        }

        report.append("\n## Cross-object dependencies\n\n");
        if (a.crossObjectDependencies.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| From | To | Via | Entry |\n");
            report.append("|---|---|---|---|\n");
            for (CrossObjectDependency d : a.crossObjectDependencies) {
                report.append("| ").append(d.sourceObject).append(" | ").append(d.targetObject)
                        .append(" | `").append(d.viaNodeId).append("` | `").append(d.entryId).append("` |\n");
            }
        }

        report.append("\n## Objects touched per object\n\n");
        if (a.objectDependencies.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (ObjectDependencySummary s : a.objectDependencies) {
                report.append("- ").append(s.object).append(": ")
                        .append(s.touchedObjects.isEmpty() ? "_(none)_" : String.join(", ", s.touchedObjects))
                        .append("\n");
            }
        }

        report.append("\n## Sharing\n\n");
        if (a.sharingNotices.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (SharingNotice n : a.sharingNotices) {
                report.append("- ").append(n.message).append("\n");
            }
        }

        report.append("\n## Diagnostics\n\n");
        if (result.diagnostics.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (Diagnostic d : result.diagnostics) {
                report.append("- ").append(d).append("\n");
            }
        }

        if (diagram != null) {
            report.append("\n## Execution diagram\n\n");
            report.append("```mermaid\n").append(diagram.mermaid);
            if (!diagram.mermaid.endsWith("\n")) report.append('\n');
            report.append("```\n");
            for (EmitterWarning w : diagram.warnings) {
                report.append("- ").append(w).append("\n");
            }
        }

        report.append("\n# Documentation (").append(result.documentation.generator).append(")\n\n");
        report.append(result.documentation.toMarkdown());
        return report.toString();
    }

    static String pathLine(ExecutionPath p) {
        StringBuilder sb = new StringBuilder("`").append(String.join("` -> `", p.nodeIds())).append("`");
        sb.append(" (depth ").append(p.depth()).append(", ").append(p.stopReason);
        if (p.recursion) sb.append(", recursion");
        if (p.truncated) sb.append(", truncated");
        return sb.append(")").toString();
    }
}
