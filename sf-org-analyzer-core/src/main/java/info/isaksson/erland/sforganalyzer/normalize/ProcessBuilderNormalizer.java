package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.metadata.ProcessBuilderMetadata;

import java.util.ArrayList;
import java.util.List;

/** Processes always start from a record change on their object, so every process is an entry point. */
final class ProcessBuilderNormalizer {

    List<AutomationNode> normalize(ProcessBuilderMetadata process, AutomationIndex index) {
        String id = NodeIds.processBuilder(process.object, process.name);
        if (!index.ownsProcess(process.name, id)) return List.of();

        DeclarativeActions actions = new DeclarativeActions(AutomationKind.PROCESS_BUILDER,
                process.name, process.object, process.file)
                .addAll(process.actions, index);
        AutomationNode.Builder b = AutomationNode.builder(id, AutomationKind.PROCESS_BUILDER)
                .name(process.name)
                .targetObject(process.object)
                .triggerContext(process.triggerContext)
                .conditions(process.conditions)
                .entryPoint(true)
                .source(process.file, 0);
        actions.actions().forEach(b::action);

        List<AutomationNode> out = new ArrayList<>();
        out.add(b.build());
        out.addAll(actions.leaves());
        return out;
    }
}
