package info.isaksson.erland.sforganalyzer.report;

import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerOptions;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerResult;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerService;
import info.isaksson.erland.sforganalyzer.graph.EdgeKind;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.graph.GraphEdge;
import info.isaksson.erland.sforganalyzer.graph.StopReason;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class ReportGeneratorTest {

    @Test
    void reportListsPathsFindingsAndFallbackDocumentation() {
        Map<String, String> sources = new TreeMap<>();
        sources.put("triggers/LeadTrigger.trigger", """
                trigger LeadTrigger on Lead (before update) {
                    LeadService.score(Trigger.new);
                }
                """);
        sources.put("classes/LeadService.cls", """
                public without sharing class LeadService {
                    public static void score(List<Lead> leads) {
                        update leads;
                    }
                }
                """);
        OrgAnalyzerOptions opts = new OrgAnalyzerOptions();
        opts.threads = 1;
        OrgAnalyzerResult res = new OrgAnalyzerService().analyzeSources(sources, MetadataBundle.empty(), opts);

        String md = ReportGenerator.toMarkdown(Path.of("src"), null, res, null, List.of("**/legacy/**"));

        assertTrue(md.startsWith("# sf-org-analyzer report\n\n## Summary\n"));
        assertTrue(md.contains("- Metadata: _(none)_\n"));
        assertTrue(md.contains("- Excludes: `**/legacy/**`\n"));
        assertTrue(md.contains("| `trigger` | 1 |\n"), md);
        assertTrue(md.contains("1. `trigger:Lead:LeadTrigger.beforeUpdate` -> `apex:LeadService:score` -> "
                + "`dml:Lead:apex.LeadService.score#1` (depth 2, LEAF)\n"), md);
        assertTrue(md.contains("**SELF_DML** update on Lead may re-fire automation on Lead"), md);
        assertTrue(md.contains("## Sharing\n\n- "), md);
        assertTrue(md.contains("## Diagnostics\n\n_(none)_\n"), md);
        assertFalse(md.contains("## Execution diagram"));
        assertTrue(md.contains("## Recommendations"));
    }

    @Test
    void pathLineFlagsRecursionAndTruncation() {
        ExecutionPath loop = new ExecutionPath("flow:A:X",
                List.of(new GraphEdge("flow:A:X", "flow:A:Y", EdgeKind.FIRES, null),
                        new GraphEdge("flow:A:Y", "flow:A:X", EdgeKind.FIRES, null)),
                true, false, StopReason.CYCLE);
        ExecutionPath cut = new ExecutionPath("flow:A:X", List.of(), false, true, StopReason.MAX_ITERATIONS);

        assertEquals("`flow:A:X` -> `flow:A:Y` -> `flow:A:X` (depth 2, CYCLE, recursion)", ReportGenerator.pathLine(loop));
        assertEquals("`flow:A:X` (depth 0, MAX_ITERATIONS, truncated)", ReportGenerator.pathLine(cut));
    }
}
