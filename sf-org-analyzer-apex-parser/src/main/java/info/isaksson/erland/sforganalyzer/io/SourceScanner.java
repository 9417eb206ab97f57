package info.isaksson.erland.sforganalyzer.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic discovery of Apex sources ({@code .cls} and {@code .trigger}).
 *
 * <p>When the root holds an {@code sfdx-project.json}, only its package directories are walked; otherwise the
 * whole root is. Tool caches and VCS folders are pruned at any depth. Results are sorted by their path relative
 * to the root, which is also the form exclude globs are matched against.</p>
 */
public final class SourceScanner {
    private static final Logger logger = LoggerFactory.getLogger(SourceScanner.class);

    private static final Set<String> PRUNED_DIRS = Set.of(".sfdx", ".sf", ".git", ".github", ".vscode",
            "node_modules", "target", "output");

    private SourceScanner() {}

    /**
     * Scan for Apex files under {@code sourceRoot}.
     *
     * @param sourceRoot an SFDX project, its {@code force-app} folder or any folder with Apex files
     * @param excludeGlobs glob patterns matched against the '/'-separated path relative to sourceRoot;
     *                     a pattern without wildcards that is not a file name excludes that whole folder
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        List<PathMatcher> excludes = compile(excludeGlobs);

        List<Path> walkRoots = SfdxProject.find(sourceRoot)
                .map(p -> p.sourceRoots(sourceRoot))
                .filter(roots -> !roots.isEmpty())
                .orElse(List.of(sourceRoot));
        if (walkRoots.size() != 1 || !walkRoots.get(0).equals(sourceRoot)) {
            logger.debug("Scanning SFDX package directories {}", walkRoots);
        }

        // keyed by relative path: sorts the result and drops overlaps between package directories
        TreeMap<String, Path> found = new TreeMap<>();
        for (Path walkRoot : walkRoots) {
            Files.walkFileTree(walkRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(walkRoot)) return FileVisitResult.CONTINUE;
                    if (PRUNED_DIRS.contains(dir.getFileName().toString())) return FileVisitResult.SKIP_SUBTREE;
                    return excluded(relative(sourceRoot, dir), excludes)
                            ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isApexSource(file)) {
                        String rel = relative(sourceRoot, file);
                        if (!excluded(rel, excludes)) found.putIfAbsent(rel, file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        return new ArrayList<>(found.values());
    }

    static boolean isApexSource(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".cls") || name.endsWith(".trigger");
    }

    private static List<PathMatcher> compile(List<String> globs) {
        List<PathMatcher> out = new ArrayList<>();
        if (globs == null) return out;
        for (String raw : globs) {
            if (raw == null || raw.isBlank()) continue;
            String glob = raw.trim().replace('\\', '/');
            if (glob.endsWith("/")) glob = glob + "**";
            boolean literal = glob.chars().noneMatch(c -> c == '*' || c == '?' || c == '[' || c == '{');
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (literal && !isApexSource(Path.of(glob))) {
                out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob + "/**"));
            }
        }
        return out;
    }

    private static boolean excluded(String rel, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) return false;
        Path p = Path.of(rel);
        for (PathMatcher m : excludes) {
            if (m.matches(p)) return true;
        }
        return false;
    }

    private static String relative(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }
}
