package info.isaksson.erland.sforganalyzer.core;

import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.analysis.ExecutionPathAnalyzer;
import info.isaksson.erland.sforganalyzer.apex.ApexBatchResult;
import info.isaksson.erland.sforganalyzer.apex.ApexParser;
import info.isaksson.erland.sforganalyzer.apex.ApexSourceBatchParser;
import info.isaksson.erland.sforganalyzer.config.ExecutionOptions;
import info.isaksson.erland.sforganalyzer.diag.Diagnostic;
import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.doc.DocumentationSnapshot;
import info.isaksson.erland.sforganalyzer.doc.DocumentationSnapshotBuilder;
import info.isaksson.erland.sforganalyzer.doc.FallbackDocumentationGenerator;
import info.isaksson.erland.sforganalyzer.doc.GeneratedDocumentation;
import info.isaksson.erland.sforganalyzer.io.SourceScanner;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.normalize.AutomationNormalizer;
import info.isaksson.erland.sforganalyzer.normalize.NormalizedAutomations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Pipeline facade: parse, normalize, analyze, snapshot.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. The execution
 * bounds are validated before any file is read.</p>
 */
public final class OrgAnalyzerService {
    private static final Logger logger = LoggerFactory.getLogger(OrgAnalyzerService.class);

    /** Analyze every {@code .cls} and {@code .trigger} file below {@code sourceRoot}. */
    public OrgAnalyzerResult analyzeSource(Path sourceRoot, MetadataBundle metadata, OrgAnalyzerOptions options)
            throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        OrgAnalyzerOptions opts = options == null ? new OrgAnalyzerOptions() : options;
        ExecutionOptions execution = opts.config.toExecutionOptions();

        List<Path> files = SourceScanner.scan(sourceRoot, opts.excludeGlobs == null ? List.of() : opts.excludeGlobs);
        logger.info("Found {} Apex files under {}", files.size(), sourceRoot);
        ApexBatchResult parsed = batchParser(opts).parseFiles(sourceRoot, files);
        return analyzeParsed(parsed, metadata, opts, execution);
    }

    /** Analyze in-memory sources keyed by file identifier. */
    public OrgAnalyzerResult analyzeSources(Map<String, String> sources, MetadataBundle metadata, OrgAnalyzerOptions options) {
        if (sources == null) throw new IllegalArgumentException("sources must not be null");
        OrgAnalyzerOptions opts = options == null ? new OrgAnalyzerOptions() : options;
        ExecutionOptions execution = opts.config.toExecutionOptions();
        return analyzeParsed(batchParser(opts).parseSources(sources), metadata, opts, execution);
    }

    private OrgAnalyzerResult analyzeParsed(ApexBatchResult parsed, MetadataBundle metadata, OrgAnalyzerOptions opts,
                                            ExecutionOptions execution) {
        ApexCodebase codebase = parsed.codebase;
        NormalizedAutomations automations = new AutomationNormalizer().normalize(codebase, metadata);
        AnalysisResult analysis = new ExecutionPathAnalyzer(execution).analyze(automations.nodes, opts.selection);

        DocumentationSnapshot snapshot = new DocumentationSnapshotBuilder()
                .build(analysis.selection, codebase, analysis);
        GeneratedDocumentation documentation = (opts.documentationGenerator == null
                ? new FallbackDocumentationGenerator()
                : opts.documentationGenerator).generate(snapshot);

        Diagnostics all = new Diagnostics();
        all.addAll(parsed.diagnostics);
        all.addAll(automations.diagnostics);
        all.addAll(analysis.diagnostics);
        List<Diagnostic> diagnostics = all.sorted();
        if (!diagnostics.isEmpty()) {
            logger.warn("{} diagnostics ({} from parsing)", diagnostics.size(),
                    parsed.diagnostics.size());
        }
        return new OrgAnalyzerResult(parsed.filesParsed, codebase, automations, analysis, snapshot, documentation,
                diagnostics);
    }

    private static ApexSourceBatchParser batchParser(OrgAnalyzerOptions opts) {
        return new ApexSourceBatchParser(new ApexParser(opts.config.toParserOptions()), opts.threads);
    }
}
