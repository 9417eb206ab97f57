package info.isaksson.erland.sforganalyzer.diagram;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which details the graph serializer puts into the diagram.
 *
 * <p>Mirrors the {@code visualization.*} configuration keys in a structured form.</p>
 */
public final class VisualizationOptions {
    /** Condition text in declarative node labels and on the edges they fire. */
    public boolean includeConditions = true;
    public boolean showDmlOperations = true;
    public boolean showSoqlQueries = true;

    /** Fill colour per style class, in classDef order. */
    public Map<String, String> styles = defaultStyles();

    public static VisualizationOptions defaults() {
        return new VisualizationOptions();
    }

    public static Map<String, String> defaultStyles() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("trigger", "#f96");
        m.put("flow", "#9cf");
        m.put("process_builder", "#9f9");
        m.put("workflow", "#f9f");
        m.put("apex", "#ff9");
        m.put("dml", "#ddd");
        m.put("soql", "#cdf");
        m.put(GraphSerializer.UNRESOLVED_STYLE, "#fcc");
        m.put(GraphSerializer.TRUNCATED_STYLE, "#eee");
        return m;
    }
}
