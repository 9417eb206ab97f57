package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.metadata.WorkflowRuleMetadata;

import java.util.ArrayList;
import java.util.List;

final class WorkflowRuleNormalizer {

    List<AutomationNode> normalize(WorkflowRuleMetadata rule, AutomationIndex index) {
        String id = NodeIds.workflowRule(rule.object, rule.name);
        if (!index.ownsWorkflowRule(rule.name, id)) return List.of();

        DeclarativeActions actions = new DeclarativeActions(AutomationKind.WORKFLOW_RULE,
                rule.name, rule.object, rule.file)
                .addAll(rule.actions, index);
        AutomationNode.Builder b = AutomationNode.builder(id, AutomationKind.WORKFLOW_RULE)
                .name(rule.name)
                .targetObject(rule.object)
                .triggerContext(rule.triggerContext)
                .conditions(rule.conditions)
                .entryPoint(true)
                .source(rule.file, 0);
        actions.actions().forEach(b::action);

        List<AutomationNode> out = new ArrayList<>();
        out.add(b.build());
        out.addAll(actions.leaves());
        return out;
    }
}
