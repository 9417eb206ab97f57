package info.isaksson.erland.sforganalyzer.mermaid;

import info.isaksson.erland.sforganalyzer.diagram.DiagramDocument;
import info.isaksson.erland.sforganalyzer.diagram.DiagramEdge;
import info.isaksson.erland.sforganalyzer.diagram.DiagramNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MermaidWriterTest {

    private static DiagramDocument doc(String title) {
        Map<String, String> styles = new LinkedHashMap<>();
        styles.put("trigger", "#f96");
        styles.put("apex", "#ff9");
        return new DiagramDocument(title,
                List.of(new DiagramNode("trigger:Account:T.beforeInsert", "T\n(trigger)", "trigger"),
                        new DiagramNode("apex:Svc:run", "Svc.run\n(apex)", "apex"),
                        new DiagramNode("apex:Svc:go", "Say \"hi\"", "apex")),
                List.of(new DiagramEdge("trigger:Account:T.beforeInsert", "apex:Svc:run", "before insert"),
                        new DiagramEdge("apex:Svc:run", "apex:Svc:go", null)),
                styles);
    }

    @Test
    void rendersGraphTdWithClassDefs() {
        String expected = ""
                + "graph TD\n"
                + "    trigger_Account_T_beforeInsert[\"T<br/>(trigger)\"]\n"
                + "    apex_Svc_run[\"Svc.run<br/>(apex)\"]\n"
                + "    apex_Svc_go[\"Say #quot;hi#quot;\"]\n"
                + "    trigger_Account_T_beforeInsert -->|\"before insert\"| apex_Svc_run\n"
                + "    apex_Svc_run --> apex_Svc_go\n"
                + "    classDef trigger fill:#f96,stroke:#333,stroke-width:2px\n"
                + "    classDef apex fill:#ff9,stroke:#333,stroke-width:2px\n"
                + "    class trigger_Account_T_beforeInsert trigger\n"
                + "    class apex_Svc_run,apex_Svc_go apex\n";

        assertEquals(expected, MermaidWriter.writeToString(doc("")));
    }

    @Test
    void fencedOutputWithTitleIsMarkdownReady() {
        String out = MermaidWriter.writeToString(doc("Account"), true);

        assertTrue(out.startsWith("```mermaid\n---\ntitle: Account\n---\ngraph TD\n"), out);
        assertTrue(out.endsWith("```\n"));
        assertEquals(out, MermaidWriter.writeToString(doc("Account"), true));
    }

    @Test
    void sanitizedIdsStayUnique() {
        Map<String, String> ids = MermaidWriter.mermaidIds(List.of(
                new DiagramNode("a:b", null, null),
                new DiagramNode("a.b", null, null),
                new DiagramNode("end", null, null),
                new DiagramNode("9x", null, null)));

        assertEquals("a_b", ids.get("a:b"));
        assertEquals("a_b_2", ids.get("a.b"));
        assertEquals("n_end", ids.get("end"));
        assertEquals("n_9x", ids.get("9x"));
    }
}
