package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.diag.DiagnosticKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ApexSourceBatchParserTest {

    @Test
    void malformedFileDoesNotAbortSiblings() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("classes/A.cls", "public class A { public void a() { insert new Account(); } }");
        sources.put("classes/Broken.cls", "public class Broken {\n public void x() {\n");
        sources.put("classes/C.cls", "public class C { }");
        sources.put("triggers/T.trigger", "trigger T on Account (after insert) { A.a(); }");

        ApexBatchResult r = new ApexSourceBatchParser(new ApexParser(), 4).parseSources(sources);

        assertEquals(4, r.filesParsed);
        assertEquals(2, r.codebase.classes.size());
        assertTrue(r.codebase.findClass("A").isPresent());
        assertTrue(r.codebase.findClass("C").isPresent());
        assertTrue(r.codebase.findClass("Broken").isEmpty());
        assertEquals(1, r.codebase.triggers.size());

        assertEquals(1, r.diagnostics.size());
        Diagnostic d = r.diagnostics.get(0);
        assertEquals(DiagnosticKind.PARSE_ERROR, d.kind);
        assertEquals("classes/Broken.cls", d.file);
    }

    @Test
    void unexpectedParserFailureBecomesADiagnosticForThatFile() {
        ApexParser real = new ApexParser();
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("classes/A.cls", "public class A { }");
        sources.put("classes/Crash.cls", "public class Crash { }");
        sources.put("classes/C.cls", "public class C { }");

        for (int threads : new int[] {1, 3}) {
            ApexBatchResult r = new ApexSourceBatchParser((file, text) -> {
                if (file.endsWith("Crash.cls")) throw new IndexOutOfBoundsException("token 7");
                return real.parse(file, text);
            }, threads).parseSources(sources);

            assertEquals(3, r.filesParsed);
            assertTrue(r.codebase.findClass("A").isPresent());
            assertTrue(r.codebase.findClass("C").isPresent());
            assertTrue(r.codebase.findClass("Crash").isEmpty());
            assertEquals(1, r.diagnostics.size());
            Diagnostic d = r.diagnostics.get(0);
            assertEquals(DiagnosticKind.PARSE_ERROR, d.kind);
            assertEquals("classes/Crash.cls", d.file);
            assertTrue(d.message.contains("token 7"), d.message);
        }
    }

    @Test
    void duplicateTopLevelClassKeepsFirstInInputOrder() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a/Dup.cls", "public class Dup { public void first() {} }");
        sources.put("b/Dup.cls", "public class Dup { public void second() {} }");

        ApexBatchResult r = new ApexSourceBatchParser(new ApexParser(), 2).parseSources(sources);

        assertEquals("first", r.codebase.findClass("Dup").orElseThrow().methods.get(0).name);
        assertEquals(1, r.diagnostics.size());
        assertEquals(DiagnosticKind.DUPLICATE_DEFINITION, r.diagnostics.get(0).kind);
        assertEquals("b/Dup.cls", r.diagnostics.get(0).file);
    }

    @Test
    void parallelAndSequentialRunsAgree() {
        Map<String, String> sources = new LinkedHashMap<>();
        for (int i = 0; i < 20; i++) {
            sources.put("classes/C" + i + ".cls", "public class C" + i + " { void m() { C" + (i + 1) + ".m(); } }");
        }

        ApexBatchResult seq = new ApexSourceBatchParser(new ApexParser(), 1).parseSources(sources);
        ApexBatchResult par = new ApexSourceBatchParser(new ApexParser(), 8).parseSources(sources);

        assertEquals(seq.codebase.classes, par.codebase.classes);
        assertEquals(seq.diagnostics, par.diagnostics);
    }

    @Test
    void filesAreReadRelativeToRoot(@TempDir Path dir) throws Exception {
        Path cls = dir.resolve("force-app/main/default/classes/Svc.cls");
        Files.createDirectories(cls.getParent());
        Files.writeString(cls, "public class Svc { }");

        ApexBatchResult r = new ApexSourceBatchParser(new ApexParser(), 2)
                .parseFiles(dir, List.of(cls, dir.resolve("missing/Gone.cls")));

        assertEquals("force-app/main/default/classes/Svc.cls", r.codebase.classes.get(0).file);
        assertEquals(1, r.diagnostics.size());
        assertEquals("missing/Gone.cls", r.diagnostics.get(0).file);
    }
}
