package info.isaksson.erland.sforganalyzer.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.List;

/**
 * A decoded Flow. Record-triggered flows are entry points; other flows (screen, autolaunched) only run when
 * something fires them.
 */
@JsonPropertyOrder({"name","object","recordTriggered","triggerContext","active","conditions","actions","file"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FlowMetadata {
    public final String name;
    public final String object;
    public final boolean recordTriggered;
    public final TriggerContext triggerContext;
    public final boolean active;
    public final List<String> conditions;
    public final List<AutomationAction> actions;
    public final String file;

    @JsonCreator
    public FlowMetadata(
            @JsonProperty("name") String name,
            @JsonProperty("object") String object,
            @JsonProperty("recordTriggered") boolean recordTriggered,
            @JsonProperty("triggerContext") TriggerContext triggerContext,
            @JsonProperty("active") Boolean active,
            @JsonProperty("conditions") List<String> conditions,
            @JsonProperty("actions") List<AutomationAction> actions,
            @JsonProperty("file") String file
    ) {
        this.name = name;
        this.object = object;
        this.recordTriggered = recordTriggered;
        this.triggerContext = triggerContext;
        this.active = active == null || active;
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.file = file;
    }
}
