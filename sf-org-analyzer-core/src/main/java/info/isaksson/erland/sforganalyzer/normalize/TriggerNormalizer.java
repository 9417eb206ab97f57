package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry-point node per trigger context ({@code trigger:Account:AccountTrigger.beforeInsert}). All context
 * nodes of a trigger share the same body actions and DML/SOQL leaves, since the body is the same code.
 */
final class TriggerNormalizer {

    List<AutomationNode> normalize(ApexTrigger trigger, AutomationIndex index) {
        ApexBodyActions body = new ApexBodyActions(AutomationKind.TRIGGER, trigger.name, trigger.file)
                .add(trigger.dmlOperations, trigger.soqlQueries, trigger.callSites, null, index);

        List<AutomationNode> out = new ArrayList<>();
        for (TriggerContext ctx : trigger.contexts) {
            AutomationNode.Builder b = AutomationNode.builder(NodeIds.trigger(trigger.objectName, trigger.name, ctx),
                            AutomationKind.TRIGGER)
                    .name(trigger.name)
                    .targetObject(trigger.objectName)
                    .triggerContext(ctx)
                    .entryPoint(true)
                    .source(trigger.file, trigger.line);
            body.actions().forEach(b::action);
            out.add(b.build());
        }
        if (!out.isEmpty()) out.addAll(body.leaves());
        return out;
    }
}
