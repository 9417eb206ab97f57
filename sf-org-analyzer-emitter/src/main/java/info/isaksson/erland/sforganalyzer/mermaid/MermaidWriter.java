package info.isaksson.erland.sforganalyzer.mermaid;

import info.isaksson.erland.sforganalyzer.diagram.DiagramDocument;
import info.isaksson.erland.sforganalyzer.diagram.DiagramEdge;
import info.isaksson.erland.sforganalyzer.diagram.DiagramNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders diagram primitives as a Mermaid {@code graph TD} document.
 *
 * <p>Graph node ids contain characters Mermaid does not accept in identifiers, so every node gets a
 * sanitized id; collisions are broken with a numeric suffix in declaration order. Output is a pure function
 * of the document.</p>
 */
public final class MermaidWriter {

    private static final String INDENT = "    ";
    private static final String STROKE = "stroke:#333,stroke-width:2px";

    private MermaidWriter() {}

    public static String writeToString(DiagramDocument doc) {
        return writeToString(doc, false);
    }

    /** @param fenced wrap the diagram in a Markdown {@code ```mermaid} block */
    public static String writeToString(DiagramDocument doc, boolean fenced) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        Map<String, String> ids = mermaidIds(doc.nodes);

        StringBuilder sb = new StringBuilder();
        if (fenced) sb.append("```mermaid\n");
        if (!doc.title.isEmpty()) {
            sb.append("---\n").append("title: ").append(doc.title.replace('\n', ' ')).append("\n---\n");
        }
        sb.append("graph TD\n");
        for (DiagramNode n : doc.nodes) {
            sb.append(INDENT).append(ids.get(n.id)).append("[\"").append(escapeLabel(n.label)).append("\"]\n");
        }
        for (DiagramEdge e : doc.edges) {
            String from = ids.get(e.from);
            String to = ids.get(e.to);
            if (from == null || to == null) continue;
            sb.append(INDENT).append(from).append(" -->");
            if (e.label != null) sb.append("|\"").append(escapeLabel(e.label)).append("\"|");
            sb.append(' ').append(to).append('\n');
        }
        for (Map.Entry<String, String> s : doc.styles.entrySet()) {
            sb.append(INDENT).append("classDef ").append(s.getKey())
                    .append(" fill:").append(s.getValue()).append(',').append(STROKE).append('\n');
        }
        Map<String, List<String>> byClass = new LinkedHashMap<>();
        for (String styleClass : doc.styles.keySet()) byClass.put(styleClass, new ArrayList<>());
        for (DiagramNode n : doc.nodes) {
            if (n.styleClass.isEmpty()) continue;
            byClass.computeIfAbsent(n.styleClass, k -> new ArrayList<>()).add(ids.get(n.id));
        }
        for (Map.Entry<String, List<String>> c : byClass.entrySet()) {
            if (c.getValue().isEmpty()) continue;
            sb.append(INDENT).append("class ").append(String.join(",", c.getValue()))
                    .append(' ').append(c.getKey()).append('\n');
        }
        if (fenced) sb.append("```\n");
        return sb.toString();
    }

    static Map<String, String> mermaidIds(List<DiagramNode> nodes) {
        Map<String, String> out = new HashMap<>();
        Set<String> taken = new HashSet<>();
        for (DiagramNode n : nodes) {
            if (out.containsKey(n.id)) continue;
            String base = sanitize(n.id);
            String candidate = base;
            int i = 2;
            while (!taken.add(candidate)) candidate = base + "_" + i++;
            out.put(n.id, candidate);
        }
        return out;
    }

    static String sanitize(String id) {
        StringBuilder sb = new StringBuilder(id.length());
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            sb.append(Character.isLetterOrDigit(c) && c < 128 ? c : '_');
        }
        // Mermaid reserves "end" and ids may not start with a digit.
        String s = sb.toString();
        if (s.isEmpty() || Character.isDigit(s.charAt(0)) || s.equalsIgnoreCase("end")) s = "n_" + s;
        return s;
    }

    static String escapeLabel(String label) {
        return label.replace("\"", "#quot;")
                .replace("\r\n", "\n")
                .replace("\n", "<br/>");
    }
}
