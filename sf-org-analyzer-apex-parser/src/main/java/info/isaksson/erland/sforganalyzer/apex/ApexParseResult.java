package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;

import java.util.List;

/** Outcome of parsing one file: the recovered declarations plus any diagnostics. */
public final class ApexParseResult {
    public final String file;
    public final List<ApexClass> classes;
    public final List<ApexTrigger> triggers;
    public final List<Diagnostic> diagnostics;

    public ApexParseResult(String file, List<ApexClass> classes, List<ApexTrigger> triggers, List<Diagnostic> diagnostics) {
        this.file = file == null ? "" : file;
        this.classes = classes == null ? List.of() : List.copyOf(classes);
        this.triggers = triggers == null ? List.of() : List.copyOf(triggers);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean isEmpty() {
        return classes.isEmpty() && triggers.isEmpty();
    }
}
