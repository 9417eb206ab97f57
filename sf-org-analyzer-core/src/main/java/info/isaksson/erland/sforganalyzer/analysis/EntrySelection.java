package info.isaksson.erland.sforganalyzer.analysis;

import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.List;

/**
 * Which nodes a run starts from: every natural entry point, those of one object (optionally one trigger
 * context), or explicitly named nodes.
 */
public final class EntrySelection {
    public final String object;
    public final TriggerContext context;
    public final List<String> explicitIds;

    private EntrySelection(String object, TriggerContext context, List<String> explicitIds) {
        this.object = object == null || object.isBlank() ? null : object.trim();
        this.context = context;
        this.explicitIds = explicitIds == null ? List.of() : List.copyOf(explicitIds);
    }

    public static EntrySelection all() {
        return new EntrySelection(null, null, List.of());
    }

    public static EntrySelection forObject(String object) {
        return new EntrySelection(object, null, List.of());
    }

    public static EntrySelection forContext(String object, TriggerContext context) {
        return new EntrySelection(object, context, List.of());
    }

    /** Start from these node ids, whether or not they are natural entry points. */
    public static EntrySelection forEntries(List<String> ids) {
        return new EntrySelection(null, null, ids);
    }

    public boolean isExplicit() {
        return !explicitIds.isEmpty();
    }

    boolean selects(AutomationNode node) {
        if (isExplicit()) return explicitIds.contains(node.id);
        if (!node.entryPoint) return false;
        if (object != null && !object.equalsIgnoreCase(node.targetObject)) return false;
        return context == null || context == node.triggerContext;
    }

    @Override public String toString() {
        if (isExplicit()) return "entries " + explicitIds;
        if (object == null) return "all entry points";
        return object + (context == null ? "" : " " + context.label());
    }
}
