package info.isaksson.erland.sforganalyzer;

import java.nio.file.Files;
import java.nio.file.Path;

/** Locates the bundled SFDX sample from whichever module directory the tests run in. */
final class TestRepoPaths {

    private static final Path SAMPLE_DESCRIPTOR = Path.of("samples", "mini", "sfdx-project.json");

    private TestRepoPaths() {}

    static Path resolveSamplesMini() {
        Path start = Path.of("").toAbsolutePath().normalize();
        for (Path p = start; p != null; p = p.getParent()) {
            if (Files.isRegularFile(p.resolve(SAMPLE_DESCRIPTOR))) return p.resolve(SAMPLE_DESCRIPTOR).getParent();
        }
        throw new IllegalStateException("No " + SAMPLE_DESCRIPTOR + " above " + start);
    }
}
