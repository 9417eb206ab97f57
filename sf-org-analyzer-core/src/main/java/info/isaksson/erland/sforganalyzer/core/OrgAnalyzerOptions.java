package info.isaksson.erland.sforganalyzer.core;

import info.isaksson.erland.sforganalyzer.analysis.EntrySelection;
import info.isaksson.erland.sforganalyzer.config.AnalyzerConfig;
import info.isaksson.erland.sforganalyzer.doc.DocumentationGenerator;
import info.isaksson.erland.sforganalyzer.doc.FallbackDocumentationGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline options for programmatic use.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class OrgAnalyzerOptions {
    public AnalyzerConfig config = AnalyzerConfig.defaults();

    /** Globs relative to the source root; a bare directory excludes everything below it. */
    public List<String> excludeGlobs = new ArrayList<>();

    /** Parse workers. Analysis itself is single-threaded. */
    public int threads = Math.max(1, Runtime.getRuntime().availableProcessors());

    public EntrySelection selection = EntrySelection.all();

    public DocumentationGenerator documentationGenerator = new FallbackDocumentationGenerator();
}
