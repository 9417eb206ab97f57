package info.isaksson.erland.sforganalyzer.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.List;

/**
 * A decoded workflow rule. {@code conditions} holds the rule criteria; field updates are actions of type
 * {@code field_update} and default to the rule's own object.
 */
@JsonPropertyOrder({"name","object","triggerContext","active","conditions","actions","file"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowRuleMetadata {
    public final String name;
    public final String object;
    public final TriggerContext triggerContext;
    public final boolean active;
    public final List<String> conditions;
    public final List<AutomationAction> actions;
    public final String file;

    @JsonCreator
    public WorkflowRuleMetadata(
            @JsonProperty("name") String name,
            @JsonProperty("object") String object,
            @JsonProperty("triggerContext") TriggerContext triggerContext,
            @JsonProperty("active") Boolean active,
            @JsonProperty("conditions") List<String> conditions,
            @JsonProperty("actions") List<AutomationAction> actions,
            @JsonProperty("file") String file
    ) {
        this.name = name;
        this.object = object;
        this.triggerContext = triggerContext;
        this.active = active == null || active;
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.file = file;
    }
}
