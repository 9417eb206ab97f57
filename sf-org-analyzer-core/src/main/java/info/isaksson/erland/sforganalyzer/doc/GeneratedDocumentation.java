package info.isaksson.erland.sforganalyzer.doc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"generator","overview","technicalDetails","businessImpact","recommendations"})
public final class GeneratedDocumentation {
    public final String generator;
    public final String overview;
    public final String technicalDetails;
    public final String businessImpact;
    public final List<String> recommendations;

    @JsonCreator
    public GeneratedDocumentation(
            @JsonProperty("generator") String generator,
            @JsonProperty("overview") String overview,
            @JsonProperty("technicalDetails") String technicalDetails,
            @JsonProperty("businessImpact") String businessImpact,
            @JsonProperty("recommendations") List<String> recommendations
    ) {
        this.generator = generator;
        this.overview = overview == null ? "" : overview;
        this.technicalDetails = technicalDetails == null ? "" : technicalDetails;
        this.businessImpact = businessImpact == null ? "" : businessImpact;
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public String toMarkdown() {
        StringBuilder sb = new StringBuilder();
        sb.append("## Overview\n\n").append(overview).append("\n\n");
        sb.append("## Technical Details\n\n").append(technicalDetails).append("\n\n");
        sb.append("## Business Impact\n\n").append(businessImpact).append("\n\n");
        sb.append("## Recommendations\n\n");
        for (String r : recommendations) sb.append("- ").append(r).append('\n');
        return sb.toString();
    }
}
