package info.isaksson.erland.sforganalyzer.core;

import info.isaksson.erland.sforganalyzer.analysis.EntrySelection;
import info.isaksson.erland.sforganalyzer.config.InvalidConfigurationException;
import info.isaksson.erland.sforganalyzer.diag.DiagnosticKind;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.json.ModelJson;
import info.isaksson.erland.sforganalyzer.metadata.AutomationMetadataJson;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class OrgAnalyzerServiceTest {

    private static final String TRIGGER = """
            trigger AccountTrigger on Account (before insert, after update) {
                AccountService.validateAccounts(Trigger.new);
            }
            """;

    private static final String SERVICE = """
            public with sharing class AccountService {
                public static void validateAccounts(List<Account> accounts) {
                    for (Account a : accounts) {
                        a.Description = 'checked';
                    }
                    update accounts;
                }
            }
            """;

    private static final String BROKEN = """
            public class Broken {
                public void run() {
            """;

    private static final String METADATA = """
            {
              "flows": [
                {"name": "Loop_Flow", "object": "Account", "recordTriggered": true, "triggerContext": "after update",
                 "actions": [{"type": "flow", "target": "Loop_Flow"}]}
              ]
            }
            """;

    private static Map<String, String> sources() {
        Map<String, String> s = new TreeMap<>();
        s.put("triggers/AccountTrigger.trigger", TRIGGER);
        s.put("classes/AccountService.cls", SERVICE);
        return s;
    }

    private static OrgAnalyzerOptions options() {
        OrgAnalyzerOptions o = new OrgAnalyzerOptions();
        o.threads = 2;
        return o;
    }

    @Test
    void triggerThroughApexToDmlEndToEnd() {
        OrgAnalyzerResult r = new OrgAnalyzerService().analyzeSources(sources(), MetadataBundle.empty(), options());

        assertFalse(r.hasDiagnostics(), "Unexpected diagnostics: " + r.diagnostics);
        List<ExecutionPath> before = r.analysis.pathsForContext(TriggerContext.BEFORE_INSERT);
        assertEquals(1, before.size());
        ExecutionPath p = before.get(0);
        assertEquals(List.of(
                        "trigger:Account:AccountTrigger.beforeInsert",
                        "apex:AccountService:validateAccounts",
                        "dml:Account:apex.AccountService.validateAccounts#1"),
                p.nodeIds());
        assertEquals(2, p.depth());
        assertFalse(p.recursion);
        assertTrue(r.analysis.hasRecursionRisks());
        assertEquals(Integer.valueOf(2), r.analysis.automationCounts.get("trigger"));
        assertEquals("all entry points", r.snapshot.subject);
        assertEquals("Analysis of all entry points", r.documentation.overview);
    }

    @Test
    void selfFiringFlowIsReportedOnceAsRecursion() throws Exception {
        OrgAnalyzerOptions o = options();
        o.selection = EntrySelection.forEntries(List.of("flow:Account:Loop_Flow"));

        OrgAnalyzerResult r = new OrgAnalyzerService()
                .analyzeSources(sources(), AutomationMetadataJson.readFromString(METADATA), o);

        assertEquals(1, r.analysis.paths.size());
        assertTrue(r.analysis.paths.get(0).recursion);
        assertEquals(1, r.analysis.paths.get(0).depth());
        assertTrue(r.analysis.iterationsUsed <= 100);
    }

    @Test
    void objectSelectionKeepsOnlyThatObjectsEntries() {
        OrgAnalyzerOptions o = options();
        o.selection = EntrySelection.forContext("Account", TriggerContext.AFTER_UPDATE);

        OrgAnalyzerResult r = new OrgAnalyzerService().analyzeSources(sources(), MetadataBundle.empty(), o);

        assertEquals(List.of("trigger:Account:AccountTrigger.afterUpdate"), r.analysis.graph.entryPoints);
        assertEquals("Account after update", r.analysis.selection);
    }

    @Test
    void outputIsIdenticalAcrossRunsAndThreadCounts() throws Exception {
        Map<String, String> s = sources();
        s.put("classes/Broken.cls", BROKEN);
        OrgAnalyzerOptions single = options();
        single.threads = 1;

        String a = ModelJson.toJsonString(new OrgAnalyzerService().analyzeSources(s, MetadataBundle.empty(), options()).analysis);
        String b = ModelJson.toJsonString(new OrgAnalyzerService().analyzeSources(s, MetadataBundle.empty(), single).analysis);

        assertEquals(a, b);
    }

    @Test
    void parseErrorsAreCollectedWithoutStoppingTheRun() {
        Map<String, String> s = sources();
        s.put("classes/Broken.cls", BROKEN);

        OrgAnalyzerResult r = new OrgAnalyzerService().analyzeSources(s, MetadataBundle.empty(), options());

        assertEquals(1, r.diagnostics.size());
        assertEquals(DiagnosticKind.PARSE_ERROR, r.diagnostics.get(0).kind);
        assertEquals("classes/Broken.cls", r.diagnostics.get(0).file);
        assertEquals(2, r.analysis.paths.size());
    }

    @Test
    void invalidBoundsFailBeforeAnyFileIsRead(@TempDir Path dir) {
        OrgAnalyzerOptions o = options();
        o.config.set("execution.max_depth", "0");

        assertThrows(InvalidConfigurationException.class,
                () -> new OrgAnalyzerService().analyzeSource(dir.resolve("does-not-exist"), MetadataBundle.empty(), o));
    }

    @Test
    void analyzesAnSfdxDirectory(@TempDir Path dir) throws Exception {
        Path classes = Files.createDirectories(dir.resolve("force-app/main/default/classes"));
        Path triggers = Files.createDirectories(dir.resolve("force-app/main/default/triggers"));
        Files.writeString(classes.resolve("AccountService.cls"), SERVICE);
        Files.writeString(classes.resolve("AccountService.cls-meta.xml"), "<ApexClass/>");
        Files.writeString(triggers.resolve("AccountTrigger.trigger"), TRIGGER);
        Path legacy = Files.createDirectories(dir.resolve("legacy"));
        Files.writeString(legacy.resolve("Old.cls"), BROKEN);

        OrgAnalyzerOptions o = options();
        o.excludeGlobs = List.of("legacy");
        OrgAnalyzerResult r = new OrgAnalyzerService().analyzeSource(dir, MetadataBundle.empty(), o);

        assertEquals(2, r.filesParsed);
        assertFalse(r.hasDiagnostics(), "Unexpected diagnostics: " + r.diagnostics);
        assertEquals(List.of("force-app/main/default/classes/AccountService.cls"),
                r.codebase.classes.stream().map(c -> c.file).collect(Collectors.toList()));
        assertEquals(2, r.analysis.paths.size());
    }
}
