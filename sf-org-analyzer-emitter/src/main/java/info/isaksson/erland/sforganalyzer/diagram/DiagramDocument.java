package info.isaksson.erland.sforganalyzer.diagram;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered diagram primitives: node declarations and edges in emission order, plus the fill colour of every
 * style class the nodes use.
 */
@JsonPropertyOrder({"title","nodes","edges","styles"})
public final class DiagramDocument {
    public final String title;
    public final List<DiagramNode> nodes;
    public final List<DiagramEdge> edges;
    public final Map<String, String> styles;

    @JsonCreator
    public DiagramDocument(
            @JsonProperty("title") String title,
            @JsonProperty("nodes") List<DiagramNode> nodes,
            @JsonProperty("edges") List<DiagramEdge> edges,
            @JsonProperty("styles") Map<String, String> styles
    ) {
        this.title = title == null ? "" : title;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.styles = styles == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(styles));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
