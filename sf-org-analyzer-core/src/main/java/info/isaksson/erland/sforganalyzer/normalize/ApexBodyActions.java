package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.ActionRef;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.model.CallSite;
import info.isaksson.erland.sforganalyzer.model.DmlOperation;
import info.isaksson.erland.sforganalyzer.model.SoqlQuery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the body facts of a trigger or of a group of same-named methods into ordered actions plus the DML
 * and SOQL leaf nodes they point at.
 *
 * <p>Actions are ordered by source position: line, then the column where the DML keyword, query or callee name
 * starts. Repeated calls to the same method keep only the first action.</p>
 */
final class ApexBodyActions {

    private final AutomationKind ownerKind;
    private final String owner;
    private final String file;
    private final List<Pending> pending = new ArrayList<>();
    private final List<AutomationNode> leaves = new ArrayList<>();
    private final Set<String> invoked = new LinkedHashSet<>();
    private int dmlOrdinal;
    private int soqlOrdinal;

    /**
     * @param ownerKind {@link AutomationKind#TRIGGER} or {@link AutomationKind#APEX_METHOD}
     * @param owner     {@code Class.method} or trigger name; with the kind it becomes part of the leaf identifiers
     */
    ApexBodyActions(AutomationKind ownerKind, String owner, String file) {
        this.ownerKind = ownerKind;
        this.owner = owner;
        this.file = file;
    }

    ApexBodyActions add(List<DmlOperation> dml, List<SoqlQuery> soql, List<CallSite> calls, String fromClass,
                        AutomationIndex index) {
        for (SoqlQuery q : soql) {
            String id = NodeIds.soql(q.primaryObject(), ownerKind, owner, ++soqlOrdinal);
            AutomationNode.Builder b = AutomationNode.builder(id, AutomationKind.SOQL_QUERY)
                    .name(q.query)
                    .targetObject(q.primaryObject())
                    .attribute("queryType", q.queryType().name())
                    .attribute("dynamic", String.valueOf(q.dynamic))
                    .attribute("bindVariables", String.valueOf(q.hasBindVariables()))
                    .source(file, q.line);
            q.referencedObjects.forEach(b::referencedObject);
            leaves.add(b.build());
            pending.add(new Pending(q.line, q.column, ActionRef.soql(id, "SOQL " + q.primaryObject())));
        }
        for (CallSite c : calls) {
            index.apexCallTarget(c, fromClass).ifPresent(target -> {
                if (invoked.add(target)) {
                    String text = (c.qualifier.isEmpty() ? "" : c.qualifier + ".") + c.calleeName + "()";
                    pending.add(new Pending(c.line, c.column, ActionRef.invoke(target, text)));
                }
            });
        }
        for (DmlOperation d : dml) {
            String id = NodeIds.dml(d.targetObject, ownerKind, owner, ++dmlOrdinal);
            String text = d.kind.keyword() + " " + d.targetObject;
            AutomationNode.Builder b = AutomationNode.builder(id, AutomationKind.DML_OPERATION)
                    .name(text)
                    .targetObject(d.targetObject)
                    .referencedObject(d.targetObject)
                    .attribute("operation", d.kind.keyword())
                    .attribute("bulk", String.valueOf(d.bulk))
                    .attribute("operand", d.operand)
                    .source(file, d.line);
            if (d.viaDatabaseClass) b.attribute("viaDatabase", "true");
            leaves.add(b.build());
            pending.add(new Pending(d.line, d.column, ActionRef.dml(id, text + (d.bulk ? " (bulk)" : ""))));
        }
        return this;
    }

    List<ActionRef> actions() {
        List<Pending> sorted = new ArrayList<>(pending);
        sorted.sort(Comparator.comparingInt((Pending p) -> p.line).thenComparingInt(p -> p.column));
        List<ActionRef> out = new ArrayList<>(sorted.size());
        for (Pending p : sorted) out.add(p.action);
        return out;
    }

    List<AutomationNode> leaves() {
        return List.copyOf(leaves);
    }

    private static final class Pending {
        final int line;
        final int column;
        final ActionRef action;

        Pending(int line, int column, ActionRef action) {
            this.line = line;
            this.column = column;
            this.action = action;
        }
    }
}
