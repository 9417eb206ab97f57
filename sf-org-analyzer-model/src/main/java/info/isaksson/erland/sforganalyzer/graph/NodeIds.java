package info.isaksson.erland.sforganalyzer.graph;

import info.isaksson.erland.sforganalyzer.model.TriggerContext;

/**
 * Builders for node identifiers of the form {@code {type}:{objectOrFile}:{name}}.
 *
 * <p>Identifiers are the only cross-reference mechanism between normalizers, so every producer goes
 * through these methods.</p>
 */
public final class NodeIds {

    private NodeIds() {}

    public static String trigger(String object, String triggerName, TriggerContext context) {
        return join(AutomationKind.TRIGGER, object, triggerName + "." + context.idSuffix());
    }

    public static String flow(String object, String flowName) {
        return join(AutomationKind.FLOW, object, flowName);
    }

    public static String processBuilder(String object, String processName) {
        return join(AutomationKind.PROCESS_BUILDER, object, processName);
    }

    public static String workflowRule(String object, String ruleName) {
        return join(AutomationKind.WORKFLOW_RULE, object, ruleName);
    }

    public static String apexMethod(String className, String methodName) {
        return join(AutomationKind.APEX_METHOD, className, methodName);
    }

    /**
     * {@code dml:Account:workflow.Set_Status#1}. The owner's kind is part of the name, so same-named automations
     * of different kinds get distinct leaves.
     *
     * @param owner {@code Class.method}, trigger or declarative automation name that performs the operation
     */
    public static String dml(String object, AutomationKind ownerKind, String owner, int ordinal) {
        return join(AutomationKind.DML_OPERATION, object, leafName(ownerKind, owner, ordinal));
    }

    public static String soql(String object, AutomationKind ownerKind, String owner, int ordinal) {
        return join(AutomationKind.SOQL_QUERY, object, leafName(ownerKind, owner, ordinal));
    }

    /** The kind encoded in an identifier's first segment. */
    public static AutomationKind kindOf(String id) {
        if (id == null) throw new IllegalArgumentException("id is null");
        int colon = id.indexOf(':');
        if (colon <= 0) throw new IllegalArgumentException("Malformed node id: " + id);
        return AutomationKind.fromIdPrefix(id.substring(0, colon));
    }

    private static String leafName(AutomationKind ownerKind, String owner, int ordinal) {
        if (ownerKind == null || ownerKind.isLeaf()) {
            throw new IllegalArgumentException("Leaf owner must be an automation or Apex method: " + ownerKind);
        }
        return ownerKind.idPrefix() + "." + blankToUnknown(owner) + "#" + ordinal;
    }

    private static String join(AutomationKind kind, String scope, String name) {
        return kind.idPrefix() + ":" + blankToUnknown(scope) + ":" + blankToUnknown(name);
    }

    private static String blankToUnknown(String s) {
        return s == null || s.isBlank() ? "Unknown" : s.trim();
    }
}
