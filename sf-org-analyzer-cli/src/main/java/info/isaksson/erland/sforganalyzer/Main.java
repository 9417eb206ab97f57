package info.isaksson.erland.sforganalyzer;

import info.isaksson.erland.sforganalyzer.analysis.EntrySelection;
import info.isaksson.erland.sforganalyzer.config.AnalyzerConfig;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerOptions;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerResult;
import info.isaksson.erland.sforganalyzer.core.OrgAnalyzerService;
import info.isaksson.erland.sforganalyzer.diagram.VisualizationOptions;
import info.isaksson.erland.sforganalyzer.emitter.DiagramEmitter;
import info.isaksson.erland.sforganalyzer.json.ModelJson;
import info.isaksson.erland.sforganalyzer.metadata.AutomationMetadataJson;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import info.isaksson.erland.sforganalyzer.report.AnalysisDocument;
import info.isaksson.erland.sforganalyzer.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI entrypoint: parse an Apex source tree plus optional declarative metadata, enumerate execution paths and
 * write the analysis, diagram, documentation snapshot and a markdown report to the output folder.
 */
public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final OrgAnalyzerService SERVICE = new OrgAnalyzerService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.source == null) {
            System.err.println("Error: --source is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: --source must be an existing directory: " + sourcePath);
            return 1;
        }
        final Path metadataPath = parsed.metadata == null ? null : Paths.get(parsed.metadata).toAbsolutePath().normalize();
        if (metadataPath != null && !Files.isRegularFile(metadataPath)) {
            System.err.println("Error: --metadata must point to an existing JSON file: " + metadataPath);
            return 1;
        }

        final AnalyzerConfig config;
        final OrgAnalyzerOptions options;
        try {
            config = parsed.config == null ? AnalyzerConfig.defaults() : AnalyzerConfig.load(Paths.get(parsed.config));
            for (Map.Entry<String, String> s : parsed.overrides.entrySet()) config.set(s.getKey(), s.getValue());
            // bounds are rejected before any output is created
            config.toExecutionOptions();
            options = toCoreOptions(parsed, config);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            System.err.println("Error: could not read configuration: " + parsed.config);
            System.err.println(ex.getMessage());
            return 2;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            System.err.println("Error: could not create output directory.");
            System.err.println(e.getMessage());
            return 2;
        }

        final MetadataBundle metadata;
        try {
            metadata = metadataPath == null ? MetadataBundle.empty() : AutomationMetadataJson.read(metadataPath);
        } catch (IOException e) {
            System.err.println("Error: could not read metadata JSON: " + metadataPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final OrgAnalyzerResult res;
        try {
            res = SERVICE.analyzeSource(sourcePath, metadata, options);
        } catch (IOException e) {
            System.err.println("Error: could not read sources under: " + sourcePath);
            System.err.println(e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        final Path analysisOut = outDir.resolve("analysis.json");
        final Path mermaidOut = outDir.resolve("execution.mmd");
        final Path diagramOut = outDir.resolve("diagram.json");
        final Path snapshotOut = outDir.resolve("documentation.json");
        final Path reportOut = outDir.resolve("report.md");
        try {
            ModelJson.write(new AnalysisDocument(sourcePath.toString(), res), analysisOut);
            DiagramEmitter.Result diagram = new DiagramEmitter(toVisualizationOptions(config))
                    .emit(res.analysis.selection, res.analysis.graph, res.analysis.paths, mermaidOut, diagramOut);
            ModelJson.write(res.snapshot, snapshotOut);
            ReportGenerator.writeMarkdown(reportOut, sourcePath, metadataPath, res, diagram, parsed.excludes);
        } catch (IOException e) {
            System.err.println("Error: could not write output to: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.failOnDiagnostics && res.hasDiagnostics()) {
            System.err.println("Diagnostics present (" + res.diagnostics.size() + ") and --fail-on-diagnostics is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }

        System.out.println(
                "sf-org-analyzer\n" +
                "- Source: " + sourcePath + "\n" +
                "- Output: " + outDir + "\n" +
                "- Apex files: " + res.filesParsed + "\n" +
                "- Automations: " + res.automations.nodes.size() + "\n" +
                "- Execution paths: " + res.analysis.paths.size() +
                " (" + res.analysis.truncatedPathCount() + " truncated)\n" +
                "- Recursion risks: " + res.analysis.recursionRisks.size() + "\n" +
                "- Diagnostics: " + res.diagnostics.size()
        );
        logger.debug("Selection: {}", res.analysis.selection);
        return 0;
    }

    private static OrgAnalyzerOptions toCoreOptions(CliArgs parsed, AnalyzerConfig config) {
        OrgAnalyzerOptions o = new OrgAnalyzerOptions();
        o.config = config;
        o.excludeGlobs = new ArrayList<>(parsed.excludes);
        if (parsed.threads > 0) o.threads = parsed.threads;
        if (!parsed.entries.isEmpty()) {
            o.selection = EntrySelection.forEntries(parsed.entries);
        } else if (parsed.context != null) {
            o.selection = EntrySelection.forContext(parsed.object, parsed.context);
        } else if (parsed.object != null) {
            o.selection = EntrySelection.forObject(parsed.object);
        }
        return o;
    }

    static VisualizationOptions toVisualizationOptions(AnalyzerConfig config) {
        AnalyzerConfig.Visualization v = config.visualization;
        VisualizationOptions o = new VisualizationOptions();
        o.includeConditions = v.includeConditions;
        o.showDmlOperations = v.showDmlOperations;
        o.showSoqlQueries = v.showSoqlQueries;
        o.styles.putAll(v.style);
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String metadata;
        String config;
        String output = "./output";

        // Entry selection
        String object;
        TriggerContext context;
        final List<String> entries = new ArrayList<>();

        final Map<String, String> overrides = new LinkedHashMap<>();
        final List<String> excludes = new ArrayList<>();
        int threads = 0;
        boolean failOnDiagnostics = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--metadata":
                        out.metadata = requireValue(args, ++i, "--metadata");
                        break;
                    case "--config":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--set":
                        parseOverride(out, requireValue(args, ++i, "--set"));
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--object":
                        out.object = requireValue(args, ++i, "--object");
                        break;
                    case "--context": {
                        String v = requireValue(args, ++i, "--context");
                        out.context = TriggerContext.parse(v)
                                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger context: " + v));
                        break;
                    }
                    case "--entry":
                        out.entries.add(requireValue(args, ++i, "--entry"));
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--threads":
                        out.threads = parsePositiveInt(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--fail-on-diagnostics":
                        out.failOnDiagnostics = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            if (!out.entries.isEmpty() && (out.object != null || out.context != null)) {
                throw new IllegalArgumentException("--entry cannot be combined with --object or --context");
            }
            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static void parseOverride(CliArgs out, String v) {
            int eq = v.indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("Expected key=value for --set: " + v);
            out.overrides.put(v.substring(0, eq).trim(), v.substring(eq + 1).trim());
        }

        static int parsePositiveInt(String v, String flag) {
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a positive integer for " + flag + ": " + v, e);
            }
            if (n <= 0) throw new IllegalArgumentException("Expected a positive integer for " + flag + ": " + v);
            return n;
        }

        static void printHelp() {
            System.out.println(
                    "sf-org-analyzer\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar sf-org-analyzer.jar --source <dir> [--metadata <file.json>] [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <dir>         SFDX project or any folder containing .cls/.trigger files (required)\n" +
                    "  --metadata <file>      Decoded Flow / Process Builder / Workflow Rule metadata (JSON)\n" +
                    "  --config <file>        YAML configuration; keys not given keep their defaults\n" +
                    "  --set <key=value>      Override one configuration key (repeatable),\n" +
                    "                         e.g. --set execution.max_depth=5\n" +
                    "  --object <name>        Only start from entry points on this object\n" +
                    "  --context <event>      Only start from this trigger context, e.g. \"before insert\"\n" +
                    "  --entry <nodeId>       Start from this node (repeatable), e.g. flow:Account:My_Flow\n" +
                    "  --output <dir>         Output folder (default: ./output)\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths relative to --source using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --threads <n>          Parse worker threads (default: available processors)\n" +
                    "  --fail-on-diagnostics  Exit with code 3 when parse or resolution diagnostics exist\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Outputs: analysis.json, execution.mmd, diagram.json, documentation.json, report.md\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar sf-org-analyzer.jar --source samples/mini/force-app --metadata samples/mini/automations.json\n" +
                    "  java -jar sf-org-analyzer.jar --source . --object Account --context \"after update\" --output out\n"
            );
        }
    }
}
