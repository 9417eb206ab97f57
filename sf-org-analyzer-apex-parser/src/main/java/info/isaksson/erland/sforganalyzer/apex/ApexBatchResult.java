package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;

import java.util.List;

/** Merged outcome of a batch: the class table plus every file's diagnostics, sorted by file and line. */
public final class ApexBatchResult {
    public final ApexCodebase codebase;
    public final List<Diagnostic> diagnostics;
    public final int filesParsed;

    public ApexBatchResult(ApexCodebase codebase, List<Diagnostic> diagnostics, int filesParsed) {
        this.codebase = codebase == null ? ApexCodebase.empty() : codebase;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        this.filesParsed = filesParsed;
    }
}
