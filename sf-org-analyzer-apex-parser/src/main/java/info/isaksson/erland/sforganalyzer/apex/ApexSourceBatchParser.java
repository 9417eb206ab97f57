package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

/**
 * Parses many files in parallel and merges the results into one {@link ApexCodebase}.
 *
 * <p>Each file is parsed independently on a worker. The merge runs only after every task has finished
 * (fan-out, then fan-in), on the calling thread, in input order; duplicate names are decided against the
 * whole table, so the first file in input order wins.</p>
 *
 * <p>A file whose parse fails with an unexpected runtime error contributes a {@code PARSE_ERROR} diagnostic and
 * no declarations; the rest of the batch is unaffected.</p>
 */
public final class ApexSourceBatchParser {
    private static final Logger logger = LoggerFactory.getLogger(ApexSourceBatchParser.class);

    private final BiFunction<String, String, ApexParseResult> parser;
    private final int threads;

    public ApexSourceBatchParser(ApexParser parser, int threads) {
        this((parser == null ? new ApexParser() : parser)::parse, threads);
    }

    /** @param parser maps (file identifier, source text) to the file's parse result */
    ApexSourceBatchParser(BiFunction<String, String, ApexParseResult> parser, int threads) {
        this.parser = parser;
        this.threads = Math.max(1, threads);
    }

    /**
     * Read and parse files. Unreadable files yield a diagnostic instead of failing the batch.
     *
     * @param root used to derive the file identifiers (relative paths with '/' separators)
     */
    public ApexBatchResult parseFiles(Path root, List<Path> files) {
        Map<String, String> sources = new LinkedHashMap<>();
        Diagnostics ioProblems = new Diagnostics();
        for (Path f : files) {
            String id = rel(root, f);
            try {
                sources.put(id, Files.readString(f, StandardCharsets.UTF_8));
            } catch (IOException e) {
                ioProblems.parseError(id, 0, "I/O error (" + e.getMessage() + ")");
                logger.warn("Could not read {}: {}", id, e.getMessage());
            }
        }
        ApexBatchResult parsed = parseSources(sources);
        Diagnostics all = new Diagnostics();
        all.addAll(parsed.diagnostics);
        all.addAll(ioProblems.sorted());
        return new ApexBatchResult(parsed.codebase, all.sorted(), parsed.filesParsed);
    }

    /** Parse in-memory sources keyed by file identifier; iteration order of the map is the merge order. */
    public ApexBatchResult parseSources(Map<String, String> sources) {
        List<ApexParseResult> results = parseAll(sources);

        Diagnostics diagnostics = new Diagnostics();
        Map<String, ApexClass> classes = new LinkedHashMap<>();
        Map<String, ApexTrigger> triggers = new LinkedHashMap<>();
        Map<String, String> classOrigin = new HashMap<>();
        for (ApexParseResult r : results) {
            diagnostics.addAll(r.diagnostics);
            for (ApexClass c : r.classes) {
                String key = c.name.toLowerCase(Locale.ROOT);
                if (classes.putIfAbsent(key, c) != null) {
                    diagnostics.duplicate(r.file, c.line,
                            "Class '" + c.name + "' is already declared in " + classOrigin.get(key));
                } else {
                    classOrigin.put(key, r.file);
                }
            }
            for (ApexTrigger t : r.triggers) {
                String key = t.name.toLowerCase(Locale.ROOT);
                if (triggers.putIfAbsent(key, t) != null) {
                    diagnostics.duplicate(r.file, t.line,
                            "Trigger '" + t.name + "' is already declared in " + triggers.get(key).file);
                }
            }
        }

        ApexCodebase codebase = new ApexCodebase(new ArrayList<>(classes.values()), new ArrayList<>(triggers.values()));
        logger.info("Parsed {} Apex files: {} classes, {} triggers, {} diagnostics",
                results.size(), codebase.classes.size(), codebase.triggers.size(), diagnostics.size());
        return new ApexBatchResult(codebase, diagnostics.sorted(), results.size());
    }

    private List<ApexParseResult> parseAll(Map<String, String> sources) {
        if (threads == 1 || sources.size() <= 1) {
            List<ApexParseResult> out = new ArrayList<>();
            sources.forEach((file, text) -> out.add(parseOne(file, text)));
            return out;
        }

        List<Callable<ApexParseResult>> tasks = new ArrayList<>();
        sources.forEach((file, text) -> tasks.add(() -> parseOne(file, text)));

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, tasks.size()));
        try {
            // invokeAll returns only once every task is done: this is the merge barrier.
            List<Future<ApexParseResult>> futures = pool.invokeAll(tasks);
            List<ApexParseResult> out = new ArrayList<>(futures.size());
            for (Future<ApexParseResult> f : futures) out.add(f.get());
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing Apex sources", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Apex parse task failed: " + e.getCause(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private ApexParseResult parseOne(String file, String text) {
        try {
            return parser.apply(file, text);
        } catch (RuntimeException e) {
            logger.warn("Parser failed on {}", file, e);
            Diagnostics d = new Diagnostics();
            d.parseError(file, 0, "Internal parser error (" + e + ")");
            return new ApexParseResult(file, List.of(), List.of(), d.sorted());
        }
    }

    private static String rel(Path root, Path file) {
        try {
            return root.relativize(file).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }
}
