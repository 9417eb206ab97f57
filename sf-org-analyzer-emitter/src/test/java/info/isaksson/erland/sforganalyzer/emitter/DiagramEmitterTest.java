package info.isaksson.erland.sforganalyzer.emitter;

import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.analysis.ExecutionPathAnalyzer;
import info.isaksson.erland.sforganalyzer.config.ExecutionOptions;
import info.isaksson.erland.sforganalyzer.diagram.DiagramDocument;
import info.isaksson.erland.sforganalyzer.diagram.DiagramJson;
import info.isaksson.erland.sforganalyzer.diagram.VisualizationOptions;
import info.isaksson.erland.sforganalyzer.graph.ActionRef;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramEmitterTest {

    private static AnalysisResult analysis() {
        String flowA = "flow:Account:A";
        String flowB = "flow:Account:B";
        return new ExecutionPathAnalyzer(ExecutionOptions.defaults()).analyzeAll(List.of(
                AutomationNode.builder(flowA, AutomationKind.FLOW).name("A").targetObject("Account")
                        .entryPoint(true).action(ActionRef.fire(flowB, "B")).build(),
                AutomationNode.builder(flowB, AutomationKind.FLOW).name("B").targetObject("Account")
                        .action(ActionRef.fire(flowA, "A")).build()));
    }

    @Test
    void writesMermaidAndJsonThatReadsBack(@TempDir Path dir) throws Exception {
        AnalysisResult a = analysis();
        DiagramEmitter.Result r = new DiagramEmitter(VisualizationOptions.defaults())
                .emit("Account", a.graph, a.paths, dir.resolve("out/execution.mmd"), dir.resolve("out/diagram.json"));

        assertEquals(r.mermaid, Files.readString(dir.resolve("out/execution.mmd")));
        assertTrue(r.mermaid.contains("    flow_Account_A --> flow_Account_B\n"), r.mermaid);
        assertTrue(r.mermaid.contains("    flow_Account_B --> flow_Account_A\n"), r.mermaid);
        assertTrue(r.warnings.isEmpty());

        DiagramDocument back = DiagramJson.read(dir.resolve("out/diagram.json"));
        assertEquals(r.document.nodes, back.nodes);
        assertEquals(r.document.edges, back.edges);
    }

    @Test
    void emissionIsDeterministic() throws Exception {
        AnalysisResult a = analysis();
        DiagramEmitter e = new DiagramEmitter(null);

        DiagramEmitter.Result first = e.emitToString("all", a.graph, null, true);
        DiagramEmitter.Result second = e.emitToString("all", a.graph, null, true);

        assertEquals(first.mermaid, second.mermaid);
        assertEquals(DiagramJson.toJsonString(first.document), DiagramJson.toJsonString(second.document));
    }
}
