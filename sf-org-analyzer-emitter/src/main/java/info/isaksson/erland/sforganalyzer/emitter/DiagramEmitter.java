package info.isaksson.erland.sforganalyzer.emitter;

import info.isaksson.erland.sforganalyzer.diagram.DiagramDocument;
import info.isaksson.erland.sforganalyzer.diagram.DiagramJson;
import info.isaksson.erland.sforganalyzer.diagram.GraphSerializer;
import info.isaksson.erland.sforganalyzer.diagram.VisualizationOptions;
import info.isaksson.erland.sforganalyzer.graph.ExecutionGraph;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.mermaid.MermaidWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Public API: render an execution graph as diagram primitives and Mermaid text.
 *
 * <p>With paths the diagram shows only what those paths walk; without, the whole graph.</p>
 */
public final class DiagramEmitter {
    private static final Logger logger = LoggerFactory.getLogger(DiagramEmitter.class);

    public static final class Result {
        public final DiagramDocument document;
        public final String mermaid;
        public final List<EmitterWarning> warnings;

        Result(DiagramDocument document, String mermaid, List<EmitterWarning> warnings) {
            this.document = document;
            this.mermaid = mermaid;
            this.warnings = warnings == null ? List.of() : warnings;
        }
    }

    private final VisualizationOptions options;

    public DiagramEmitter(VisualizationOptions options) {
        this.options = options == null ? VisualizationOptions.defaults() : options;
    }

    /** @param paths null to draw the whole graph */
    public Result emitToString(String title, ExecutionGraph graph, List<ExecutionPath> paths, boolean fenced) {
        if (graph == null) throw new IllegalArgumentException("graph must not be null");
        EmitterWarnings warnings = new EmitterWarnings();
        GraphSerializer serializer = new GraphSerializer(options);
        DiagramDocument doc = paths == null
                ? serializer.serialize(title, graph, warnings)
                : serializer.serializePaths(title, graph, paths, warnings);
        String mermaid = MermaidWriter.writeToString(doc, fenced);
        logger.debug("Diagram '{}': {} nodes, {} edges", title, doc.nodes.size(), doc.edges.size());
        return new Result(doc, mermaid, warnings.toDeterministicList());
    }

    /** Write the Mermaid text and, when {@code outJson} is given, the primitives as JSON. */
    public Result emit(String title, ExecutionGraph graph, List<ExecutionPath> paths, Path outMermaid, Path outJson)
            throws IOException {
        if (outMermaid == null) throw new IllegalArgumentException("outMermaid must not be null");
        Result r = emitToString(title, graph, paths, false);

        Path parent = outMermaid.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outMermaid, r.mermaid, StandardCharsets.UTF_8);
        if (outJson != null) DiagramJson.write(r.document, outJson);

        if (!r.warnings.isEmpty()) logger.warn("{} diagram warnings for '{}'", r.warnings.size(), title);
        logger.info("Wrote diagram with {} nodes to {}", r.document.nodes.size(), outMermaid);
        return r;
    }
}
