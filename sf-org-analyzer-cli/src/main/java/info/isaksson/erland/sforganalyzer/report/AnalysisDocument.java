package info.isaksson.erland.sforganalyzer.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerResult;
import info.isaksson.erland.sforganalyzer.diag.Diagnostic;

import java.util.List;

/** Contents of {@code analysis.json}: the analyzer result plus every diagnostic of the run. */
@JsonPropertyOrder({"source","filesParsed","automationNodes","analysis","diagnostics"})
public final class AnalysisDocument {
    public final String source;
    public final int filesParsed;
    public final int automationNodes;
    public final AnalysisResult analysis;

    /** Parse, normalization and analysis diagnostics in file/line order. */
    public final List<Diagnostic> diagnostics;

    @JsonCreator
    public AnalysisDocument(
            @JsonProperty("source") String source,
            @JsonProperty("filesParsed") int filesParsed,
            @JsonProperty("automationNodes") int automationNodes,
            @JsonProperty("analysis") AnalysisResult analysis,
            @JsonProperty("diagnostics") List<Diagnostic> diagnostics
    ) {
        this.source = source == null ? "" : source;
        this.filesParsed = filesParsed;
        this.automationNodes = automationNodes;
        this.analysis = analysis;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public AnalysisDocument(String source, OrgAnalyzerResult result) {
        this(source, result.filesParsed, result.automations.nodes.size(), result.analysis, result.diagnostics);
    }
}
