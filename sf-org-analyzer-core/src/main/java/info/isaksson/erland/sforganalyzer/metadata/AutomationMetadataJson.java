package info.isaksson.erland.sforganalyzer.metadata;

import info.isaksson.erland.sforganalyzer.json.ModelJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Reads the decoded automation metadata document:
 *
 * <pre>
 * { "flows": [...], "processBuilders": [...], "workflowRules": [...] }
 * </pre>
 *
 * <p>Records without a {@code file} get the document's own path so diagnostics can point somewhere.</p>
 */
public final class AutomationMetadataJson {
    private static final Logger logger = LoggerFactory.getLogger(AutomationMetadataJson.class);

    private AutomationMetadataJson() {}

    public static MetadataBundle read(Path file) throws IOException {
        MetadataBundle raw = ModelJson.read(file, MetadataBundle.class);
        MetadataBundle bundle = withDefaultFile(raw, file.getFileName().toString());
        logger.info("Read {} flows, {} processes, {} workflow rules from {}",
                bundle.flows.size(), bundle.processBuilders.size(), bundle.workflowRules.size(), file);
        return bundle;
    }

    public static MetadataBundle readFromString(String json) throws IOException {
        return ModelJson.readFromString(json, MetadataBundle.class);
    }

    static MetadataBundle withDefaultFile(MetadataBundle b, String file) {
        return new MetadataBundle(
                b.flows.stream().map(f -> f.file != null ? f : new FlowMetadata(f.name, f.object, f.recordTriggered,
                        f.triggerContext, f.active, f.conditions, f.actions, file)).collect(Collectors.toList()),
                b.processBuilders.stream().map(p -> p.file != null ? p : new ProcessBuilderMetadata(p.name, p.object,
                        p.triggerContext, p.active, p.conditions, p.actions, file)).collect(Collectors.toList()),
                b.workflowRules.stream().map(w -> w.file != null ? w : new WorkflowRuleMetadata(w.name, w.object,
                        w.triggerContext, w.active, w.conditions, w.actions, file)).collect(Collectors.toList()));
    }
}
