package info.isaksson.erland.sforganalyzer.diagram;

import info.isaksson.erland.sforganalyzer.json.ModelJson;

import java.io.IOException;
import java.nio.file.Path;

/** JSON form of {@link DiagramDocument}, written with the same deterministic printer as the model. */
public final class DiagramJson {

    private DiagramJson() {}

    public static void write(DiagramDocument doc, Path outFile) throws IOException {
        ModelJson.write(doc, outFile);
    }

    public static String toJsonString(DiagramDocument doc) throws IOException {
        return ModelJson.toJsonString(doc);
    }

    public static DiagramDocument read(Path file) throws IOException {
        return ModelJson.read(file, DiagramDocument.class);
    }
}
