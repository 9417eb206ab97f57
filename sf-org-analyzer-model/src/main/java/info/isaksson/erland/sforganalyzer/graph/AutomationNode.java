package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Uniform representation of every automation variant and of the DML/SOQL leaves.
 *
 * <p>{@code actions} are kept in declaration order; outgoing edges follow that order. {@code referencedObjects}
 * lists the objects a DML or SOQL leaf touches. {@code attributes} carries variant-specific facts
 * (sharing mode, bulk flag, query type, ...) in key order.</p>
 */
@JsonPropertyOrder({"id","kind","name","targetObject","triggerContext","conditions","actions","referencedObjects",
        "attributes","entryPoint","file","line"})
public final class AutomationNode {
    public final String id;
    public final AutomationKind kind;
    public final String name;
    public final String targetObject;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final TriggerContext triggerContext;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> conditions;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ActionRef> actions;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> referencedObjects;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final SortedMap<String, String> attributes;

    public final boolean entryPoint;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String file;

    public final int line;

    @JsonCreator
    public AutomationNode(
            @JsonProperty("id") String id,
            @JsonProperty("kind") AutomationKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("targetObject") String targetObject,
            @JsonProperty("triggerContext") TriggerContext triggerContext,
            @JsonProperty("conditions") List<String> conditions,
            @JsonProperty("actions") List<ActionRef> actions,
            @JsonProperty("referencedObjects") List<String> referencedObjects,
            @JsonProperty("attributes") Map<String, String> attributes,
            @JsonProperty("entryPoint") boolean entryPoint,
            @JsonProperty("file") String file,
            @JsonProperty("line") int line
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("node id is blank");
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name == null ? "" : name;
        this.targetObject = targetObject == null ? "" : targetObject;
        this.triggerContext = triggerContext;
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
        this.actions = actions == null || kind.isLeaf() ? List.of() : List.copyOf(actions);
        this.referencedObjects = referencedObjects == null ? List.of() : List.copyOf(referencedObjects);
        this.attributes = attributes == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
        this.entryPoint = entryPoint;
        this.file = file == null || file.isBlank() ? null : file;
        this.line = line;
    }

    public static Builder builder(String id, AutomationKind kind) {
        return new Builder(id, kind);
    }

    /** Copy with a different entry-point flag. */
    public AutomationNode withEntryPoint(boolean entry) {
        if (entry == entryPoint) return this;
        return new AutomationNode(id, kind, name, targetObject, triggerContext, conditions, actions,
                referencedObjects, attributes, entry, file, line);
    }

    /** Copy without outgoing actions; used when a node must act as a leaf. */
    public AutomationNode withoutActions() {
        if (actions.isEmpty()) return this;
        return new AutomationNode(id, kind, name, targetObject, triggerContext, conditions, List.of(),
                referencedObjects, attributes, entryPoint, file, line);
    }

    /** Objects read or written by this node: the referenced objects of a leaf, else the target object. */
    public List<String> touchedObjects() {
        if (!referencedObjects.isEmpty()) return referencedObjects;
        return targetObject.isEmpty() ? List.of() : List.of(targetObject);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AutomationNode)) return false;
        AutomationNode that = (AutomationNode) o;
        return entryPoint == that.entryPoint &&
                line == that.line &&
                Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(targetObject, that.targetObject) &&
                triggerContext == that.triggerContext &&
                Objects.equals(conditions, that.conditions) &&
                Objects.equals(actions, that.actions) &&
                Objects.equals(referencedObjects, that.referencedObjects) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, name, targetObject, triggerContext, conditions, actions, referencedObjects,
                attributes, entryPoint, file, line);
    }

    @Override public String toString() {
        return id;
    }

    public static final class Builder {
        private final String id;
        private final AutomationKind kind;
        private String name;
        private String targetObject;
        private TriggerContext triggerContext;
        private final List<String> conditions = new ArrayList<>();
        private final List<ActionRef> actions = new ArrayList<>();
        private final List<String> referencedObjects = new ArrayList<>();
        private final SortedMap<String, String> attributes = new TreeMap<>();
        private boolean entryPoint;
        private String file;
        private int line;

        private Builder(String id, AutomationKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder targetObject(String targetObject) { this.targetObject = targetObject; return this; }
        public Builder triggerContext(TriggerContext ctx) { this.triggerContext = ctx; return this; }
        public Builder condition(String condition) {
            if (condition != null && !condition.isBlank()) conditions.add(condition.trim());
            return this;
        }
        public Builder conditions(List<String> cs) {
            if (cs != null) cs.forEach(this::condition);
            return this;
        }
        public Builder action(ActionRef action) { if (action != null) actions.add(action); return this; }
        public Builder referencedObject(String object) {
            if (object != null && !object.isBlank() && !referencedObjects.contains(object)) referencedObjects.add(object);
            return this;
        }
        public Builder attribute(String key, String value) {
            if (key != null && value != null) attributes.put(key, value);
            return this;
        }
        public Builder entryPoint(boolean entryPoint) { this.entryPoint = entryPoint; return this; }
        public Builder source(String file, int line) { this.file = file; this.line = line; return this; }

        public AutomationNode build() {
            return new AutomationNode(id, kind, name, targetObject, triggerContext, conditions, actions,
                    referencedObjects, attributes, entryPoint, file, line);
        }
    }
}
