package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.ActionRef;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.metadata.AutomationAction;
import info.isaksson.erland.sforganalyzer.model.DmlKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates the actions of a Flow, process or workflow rule. References to other automations become
 * {@code fires} actions, Apex references {@code invokes} actions, record operations DML or SOQL leaves owned
 * by the automation. Anything else is kept as a note without a target.
 */
final class DeclarativeActions {

    private final AutomationKind ownerKind;
    private final String owner;
    private final String ownerObject;
    private final String file;
    private final List<ActionRef> actions = new ArrayList<>();
    private final List<AutomationNode> leaves = new ArrayList<>();
    private int dmlOrdinal;
    private int soqlOrdinal;

    DeclarativeActions(AutomationKind ownerKind, String owner, String ownerObject, String file) {
        this.ownerKind = ownerKind;
        this.owner = owner;
        this.ownerObject = ownerObject;
        this.file = file;
    }

    DeclarativeActions addAll(List<AutomationAction> list, AutomationIndex index) {
        for (AutomationAction a : list) add(a, index);
        return this;
    }

    private void add(AutomationAction a, AutomationIndex index) {
        String described = a.description != null ? a.description : a.toString();
        switch (a.type) {
            case APEX -> actions.add(ActionRef.invoke(index.apexActionTarget(a.target), described));
            case FLOW -> actions.add(ActionRef.fire(index.flowId(a.target), described));
            case PROCESS_BUILDER -> actions.add(ActionRef.fire(index.processId(a.target), described));
            case WORKFLOW -> actions.add(ActionRef.fire(index.workflowRuleId(a.target), described));
            case DML -> addDml(operation(a.operation), objectOf(a), described);
            case FIELD_UPDATE -> addDml(DmlKind.UPDATE, objectOf(a), described);
            case SOQL -> addSoql(objectOf(a), described);
            case NOTE -> actions.add(ActionRef.note(described));
        }
    }

    private void addDml(DmlKind kind, String object, String described) {
        String id = NodeIds.dml(object, ownerKind, owner, ++dmlOrdinal);
        String text = kind.keyword() + " " + object;
        leaves.add(AutomationNode.builder(id, AutomationKind.DML_OPERATION)
                .name(text)
                .targetObject(object)
                .referencedObject(object)
                .attribute("operation", kind.keyword())
                .attribute("declarative", "true")
                .source(file, 0)
                .build());
        actions.add(ActionRef.dml(id, described.equals(text) ? text : described));
    }

    private void addSoql(String object, String described) {
        String id = NodeIds.soql(object, ownerKind, owner, ++soqlOrdinal);
        leaves.add(AutomationNode.builder(id, AutomationKind.SOQL_QUERY)
                .name("Get " + object + " records")
                .targetObject(object)
                .referencedObject(object)
                .attribute("declarative", "true")
                .source(file, 0)
                .build());
        actions.add(ActionRef.soql(id, described));
    }

    private String objectOf(AutomationAction a) {
        return a.object != null ? a.object : ownerObject;
    }

    /** Flow record operations use create/update/delete; anything unrecognised counts as an update. */
    private static DmlKind operation(String op) {
        if (op == null) return DmlKind.UPDATE;
        DmlKind k = DmlKind.fromKeyword(op);
        if (k != null) return k;
        return switch (op.toLowerCase(Locale.ROOT)) {
            case "create", "recordcreate" -> DmlKind.INSERT;
            case "delete", "recorddelete" -> DmlKind.DELETE;
            default -> DmlKind.UPDATE;
        };
    }

    List<ActionRef> actions() {
        return List.copyOf(actions);
    }

    List<AutomationNode> leaves() {
        return List.copyOf(leaves);
    }
}
