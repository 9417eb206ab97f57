package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.metadata.FlowMetadata;

import java.util.ArrayList;
import java.util.List;

/** Flows become entry points only when record-triggered. */
final class FlowNormalizer {

    List<AutomationNode> normalize(FlowMetadata flow, AutomationIndex index) {
        String id = NodeIds.flow(flow.object, flow.name);
        if (!index.ownsFlow(flow.name, id)) return List.of();

        DeclarativeActions actions = new DeclarativeActions(AutomationKind.FLOW, flow.name, flow.object, flow.file)
                .addAll(flow.actions, index);
        AutomationNode.Builder b = AutomationNode.builder(id, AutomationKind.FLOW)
                .name(flow.name)
                .targetObject(flow.object)
                .triggerContext(flow.triggerContext)
                .conditions(flow.conditions)
                .attribute("recordTriggered", String.valueOf(flow.recordTriggered))
                .entryPoint(flow.recordTriggered)
                .source(flow.file, 0);
        actions.actions().forEach(b::action);

        List<AutomationNode> out = new ArrayList<>();
        out.add(b.build());
        out.addAll(actions.leaves());
        return out;
    }
}
