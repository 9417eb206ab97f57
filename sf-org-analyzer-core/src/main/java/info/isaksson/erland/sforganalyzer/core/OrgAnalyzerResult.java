package info.isaksson.erland.sforganalyzer.core;

import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.doc.DocumentationSnapshot;
import info.isaksson.erland.sforganalyzer.doc.GeneratedDocumentation;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.normalize.NormalizedAutomations;

import java.util.List;

/** Pipeline result container for programmatic usage. */
public final class OrgAnalyzerResult {
    /** Number of Apex files given to the parser. */
    public final int filesParsed;

    public final ApexCodebase codebase;

    public final NormalizedAutomations automations;

    public final AnalysisResult analysis;

    public final DocumentationSnapshot snapshot;

    public final GeneratedDocumentation documentation;

    /** Parse, normalization and analysis diagnostics, ordered by file then line. */
    public final List<Diagnostic> diagnostics;

    OrgAnalyzerResult(
            int filesParsed,
            ApexCodebase codebase,
            NormalizedAutomations automations,
            AnalysisResult analysis,
            DocumentationSnapshot snapshot,
            GeneratedDocumentation documentation,
            List<Diagnostic> diagnostics
    ) {
        this.filesParsed = filesParsed;
        this.codebase = codebase;
        this.automations = automations;
        this.analysis = analysis;
        this.snapshot = snapshot;
        this.documentation = documentation;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
