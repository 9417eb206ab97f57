package info.isaksson.erland.sforganalyzer.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Declarative automations supplied by the metadata provider for one analysis run. */
@JsonPropertyOrder({"flows","processBuilders","workflowRules"})
public final class MetadataBundle {
    public final List<FlowMetadata> flows;
    public final List<ProcessBuilderMetadata> processBuilders;
    public final List<WorkflowRuleMetadata> workflowRules;

    @JsonCreator
    public MetadataBundle(
            @JsonProperty("flows") List<FlowMetadata> flows,
            @JsonProperty("processBuilders") List<ProcessBuilderMetadata> processBuilders,
            @JsonProperty("workflowRules") List<WorkflowRuleMetadata> workflowRules
    ) {
        this.flows = flows == null ? List.of() : List.copyOf(flows);
        this.processBuilders = processBuilders == null ? List.of() : List.copyOf(processBuilders);
        this.workflowRules = workflowRules == null ? List.of() : List.copyOf(workflowRules);
    }

    public static MetadataBundle empty() {
        return new MetadataBundle(List.of(), List.of(), List.of());
    }

    public int size() {
        return flows.size() + processBuilders.size() + workflowRules.size();
    }
}
