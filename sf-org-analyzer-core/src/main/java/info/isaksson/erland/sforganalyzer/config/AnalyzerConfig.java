package info.isaksson.erland.sforganalyzer.config;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import info.isaksson.erland.sforganalyzer.apex.ApexParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * YAML configuration with the {@code analysis.parser}, {@code execution} and {@code visualization} sections.
 *
 * <p>{@link #defaults()} reads {@code default-config.yaml} from the classpath. {@link #load(Path)} reads a
 * user file on top of the defaults, so a file only needs the keys it changes. Sections the analyzer does not
 * know are ignored.</p>
 */
public final class AnalyzerConfig {
    private static final Logger logger = LoggerFactory.getLogger(AnalyzerConfig.class);

    static final String DEFAULT_RESOURCE = "/default-config.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @JsonMerge
    public Analysis analysis = new Analysis();

    @JsonMerge
    public Execution execution = new Execution();

    @JsonMerge
    public Visualization visualization = new Visualization();

    public static final class Analysis {
        @JsonMerge
        public Parser parser = new Parser();
    }

    public static final class Parser {
        @JsonProperty("include_inner_classes") public boolean includeInnerClasses = true;
        @JsonProperty("parse_annotations") public boolean parseAnnotations = true;
        @JsonProperty("track_dml") public boolean trackDml = true;
        @JsonProperty("track_soql") public boolean trackSoql = true;
        @JsonProperty("parse_doc_comments") public boolean parseDocComments = true;
    }

    public static final class Execution {
        @JsonProperty("max_depth") public int maxDepth = 10;
        @JsonProperty("max_iterations") public int maxIterations = 100;
        @JsonProperty("include_workflow") public boolean includeWorkflow = true;
        @JsonProperty("include_process_builder") public boolean includeProcessBuilder = true;
        @JsonProperty("include_flows") public boolean includeFlows = true;
        @JsonProperty("follow_apex") public boolean followApex = true;
        @JsonProperty("track_sharing") public boolean trackSharing = true;
    }

    public static final class Visualization {
        @JsonProperty("include_conditions") public boolean includeConditions = true;
        @JsonProperty("show_dml_operations") public boolean showDmlOperations = true;
        @JsonProperty("show_soql_queries") public boolean showSoqlQueries = true;

        /** Fill colour per node kind prefix ({@code trigger}, {@code flow}, ...). */
        @JsonMerge
        @JsonProperty("style")
        public Map<String, String> style = new LinkedHashMap<>();
    }

    /** Configuration from the bundled defaults. */
    public static AnalyzerConfig defaults() {
        try (InputStream in = AnalyzerConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on classpath; using built-in defaults", DEFAULT_RESOURCE);
                return new AnalyzerConfig();
            }
            return YAML.readValue(in, AnalyzerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Defaults overlaid with a YAML file.
     *
     * @throws InvalidConfigurationException if a known key has a value of the wrong type
     */
    public static AnalyzerConfig load(Path file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        AnalyzerConfig config = defaults();
        try (InputStream in = Files.newInputStream(file)) {
            YAML.readerForUpdating(config).readValue(in);
        } catch (MismatchedInputException e) {
            throw new InvalidConfigurationException("Invalid value in " + file + ": " + e.getOriginalMessage(), e);
        }
        logger.info("Loaded configuration from {}", file);
        return config;
    }

    /**
     * Apply a dotted override such as {@code execution.max_depth=5}. The {@code analysis.} prefix of parser
     * keys is optional.
     *
     * @throws InvalidConfigurationException for an unknown key or a malformed value
     */
    public AnalyzerConfig set(String key, String value) {
        if (key == null || key.isBlank()) throw new InvalidConfigurationException("Empty configuration key");
        String k = key.trim().toLowerCase(Locale.ROOT);
        if (k.startsWith("analysis.")) k = k.substring("analysis.".length());
        Parser p = analysis.parser;
        Execution x = execution;
        Visualization v = visualization;
        switch (k) {
            case "parser.include_inner_classes" -> p.includeInnerClasses = bool(key, value);
            case "parser.parse_annotations" -> p.parseAnnotations = bool(key, value);
            case "parser.track_dml" -> p.trackDml = bool(key, value);
            case "parser.track_soql" -> p.trackSoql = bool(key, value);
            case "parser.parse_doc_comments" -> p.parseDocComments = bool(key, value);
            case "execution.max_depth" -> x.maxDepth = integer(key, value);
            case "execution.max_iterations" -> x.maxIterations = integer(key, value);
            case "execution.include_workflow" -> x.includeWorkflow = bool(key, value);
            case "execution.include_process_builder" -> x.includeProcessBuilder = bool(key, value);
            case "execution.include_flows" -> x.includeFlows = bool(key, value);
            case "execution.follow_apex" -> x.followApex = bool(key, value);
            case "execution.track_sharing" -> x.trackSharing = bool(key, value);
            case "visualization.include_conditions" -> v.includeConditions = bool(key, value);
            case "visualization.show_dml_operations" -> v.showDmlOperations = bool(key, value);
            case "visualization.show_soql_queries" -> v.showSoqlQueries = bool(key, value);
            default -> {
                if (k.startsWith("visualization.style.") && value != null && !value.isBlank()) {
                    v.style.put(k.substring("visualization.style.".length()), value.trim());
                } else {
                    throw new InvalidConfigurationException("Unknown configuration key: " + key);
                }
            }
        }
        return this;
    }

    public ApexParserOptions toParserOptions() {
        Parser p = analysis.parser;
        ApexParserOptions o = new ApexParserOptions();
        o.includeInnerClasses = p.includeInnerClasses;
        o.parseAnnotations = p.parseAnnotations;
        o.trackDml = p.trackDml;
        o.trackSoql = p.trackSoql;
        o.parseDocComments = p.parseDocComments;
        return o;
    }

    /** @throws InvalidConfigurationException if a bound is not positive */
    public ExecutionOptions toExecutionOptions() {
        ExecutionOptions o = new ExecutionOptions();
        o.maxDepth = execution.maxDepth;
        o.maxIterations = execution.maxIterations;
        o.includeWorkflow = execution.includeWorkflow;
        o.includeProcessBuilder = execution.includeProcessBuilder;
        o.includeFlows = execution.includeFlows;
        o.followApex = execution.followApex;
        o.trackSharing = execution.trackSharing;
        return o.validate();
    }

    private static boolean bool(String key, String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new InvalidConfigurationException("Expected true/false for " + key + " but got '" + value + "'");
        };
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Expected an integer for " + key + " but got '" + value + "'", e);
        }
    }
}
