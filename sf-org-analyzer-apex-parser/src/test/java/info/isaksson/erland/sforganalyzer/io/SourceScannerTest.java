package info.isaksson.erland.sforganalyzer.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @Test
    void findsApexSourcesSortedAndHonoursExcludes(@TempDir Path root) throws Exception {
        touch(root, "force-app/main/default/triggers/AccountTrigger.trigger");
        touch(root, "force-app/main/default/classes/B.cls");
        touch(root, "force-app/main/default/classes/A.cls");
        touch(root, "force-app/main/default/classes/A.cls-meta.xml");
        touch(root, ".sfdx/tools/Cached.cls");
        touch(root, "legacy/Old.cls");

        List<String> found = SourceScanner.scan(root, List.of("legacy")).stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toList());

        assertEquals(List.of(
                "force-app/main/default/classes/A.cls",
                "force-app/main/default/classes/B.cls",
                "force-app/main/default/triggers/AccountTrigger.trigger"), found);
    }

    @Test
    void sfdxProjectLimitsTheWalkToPackageDirectories(@TempDir Path root) throws Exception {
        Files.writeString(root.resolve("sfdx-project.json"), """
                {
                  "packageDirectories": [ { "path": "force-app", "default": true }, { "path": "not-there" } ],
                  "sourceApiVersion": "59.0"
                }
                """);
        touch(root, "force-app/main/default/classes/Service.cls");
        touch(root, "force-app/main/default/classes/ServiceTest.cls");
        touch(root, "force-app/main/default/lwc/node_modules/Vendored.cls");
        touch(root, "scripts/apex/Anonymous.cls");

        List<String> found = SourceScanner.scan(root, List.of("**/*Test.cls")).stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toList());

        assertEquals(List.of("force-app/main/default/classes/Service.cls"), found);
    }

    @Test
    void folderWithoutSfdxDescriptorIsWalkedWhole(@TempDir Path root) throws Exception {
        touch(root, "src/Loose.cls");
        touch(root, "output/Generated.cls");

        List<Path> found = SourceScanner.scan(root, null);

        assertEquals(List.of(root.resolve("src/Loose.cls")), found);
    }

    private static void touch(Path root, String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "");
    }
}
