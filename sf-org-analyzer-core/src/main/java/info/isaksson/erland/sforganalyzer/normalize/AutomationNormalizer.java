package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.metadata.FlowMetadata;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.metadata.ProcessBuilderMetadata;
import info.isaksson.erland.sforganalyzer.metadata.WorkflowRuleMetadata;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs every normalizer over one parsed codebase and one metadata bundle.
 *
 * <p>Node order is deterministic: triggers, Apex classes (table order), flows, processes, workflow rules,
 * each in input order. Inactive declarative automations are skipped. Identifiers produced twice keep the
 * first node.</p>
 */
public final class AutomationNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(AutomationNormalizer.class);

    private final TriggerNormalizer triggers = new TriggerNormalizer();
    private final ApexMethodNormalizer methods = new ApexMethodNormalizer();
    private final FlowNormalizer flows = new FlowNormalizer();
    private final ProcessBuilderNormalizer processes = new ProcessBuilderNormalizer();
    private final WorkflowRuleNormalizer workflowRules = new WorkflowRuleNormalizer();

    public NormalizedAutomations normalize(ApexCodebase codebase, MetadataBundle metadata) {
        ApexCodebase cb = codebase == null ? ApexCodebase.empty() : codebase;
        MetadataBundle md = metadata == null ? MetadataBundle.empty() : metadata;
        Diagnostics diagnostics = new Diagnostics();
        AutomationIndex index = new AutomationIndex(cb, md, diagnostics);

        List<AutomationNode> nodes = new ArrayList<>();
        Set<String> ids = new LinkedHashSet<>();
        for (ApexTrigger t : cb.triggers) addAll(nodes, ids, triggers.normalize(t, index));
        for (ApexClass c : cb.allClasses()) addAll(nodes, ids, methods.normalize(c, index));
        for (FlowMetadata f : md.flows) {
            if (!f.active) {
                logger.debug("Skipping inactive flow {}", f.name);
                continue;
            }
            addAll(nodes, ids, flows.normalize(f, index));
        }
        for (ProcessBuilderMetadata p : md.processBuilders) {
            if (!p.active) {
                logger.debug("Skipping inactive process {}", p.name);
                continue;
            }
            addAll(nodes, ids, processes.normalize(p, index));
        }
        for (WorkflowRuleMetadata w : md.workflowRules) {
            if (!w.active) {
                logger.debug("Skipping inactive workflow rule {}", w.name);
                continue;
            }
            addAll(nodes, ids, workflowRules.normalize(w, index));
        }

        logger.info("Normalized {} automation nodes ({} triggers, {} classes, {} declarative automations)",
                nodes.size(), cb.triggers.size(), cb.allClasses().size(), md.size());
        return new NormalizedAutomations(nodes, diagnostics.sorted());
    }

    private static void addAll(List<AutomationNode> nodes, Set<String> ids, List<AutomationNode> produced) {
        for (AutomationNode n : produced) {
            if (ids.add(n.id)) nodes.add(n);
            else logger.debug("Node {} already produced; keeping the first", n.id);
        }
    }
}
