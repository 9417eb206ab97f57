package info.isaksson.erland.sforganalyzer.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import info.isaksson.erland.sforganalyzer.json.ModelJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** The part of {@code sfdx-project.json} that says where sources live. Other keys are ignored. */
public final class SfdxProject {

    public static final String DESCRIPTOR = "sfdx-project.json";

    public final List<PackageDirectory> packageDirectories;

    @JsonCreator
    public SfdxProject(@JsonProperty("packageDirectories") List<PackageDirectory> packageDirectories) {
        this.packageDirectories = packageDirectories == null ? List.of() : List.copyOf(packageDirectories);
    }

    /** Reads the descriptor in {@code projectRoot}, or empty when the folder is not an SFDX project. */
    public static Optional<SfdxProject> find(Path projectRoot) throws IOException {
        Path descriptor = projectRoot.resolve(DESCRIPTOR);
        if (!Files.isRegularFile(descriptor)) return Optional.empty();
        return Optional.of(ModelJson.read(descriptor, SfdxProject.class));
    }

    /** Existing package directories, resolved against {@code projectRoot}, in declaration order. */
    public List<Path> sourceRoots(Path projectRoot) {
        List<Path> out = new ArrayList<>();
        for (PackageDirectory d : packageDirectories) {
            if (d.path == null || d.path.isBlank()) continue;
            Path p = projectRoot.resolve(d.path).normalize();
            if (Files.isDirectory(p) && !out.contains(p)) out.add(p);
        }
        return out;
    }

    public static final class PackageDirectory {
        public final String path;

        @JsonCreator
        public PackageDirectory(@JsonProperty("path") String path) {
            this.path = path;
        }
    }
}
