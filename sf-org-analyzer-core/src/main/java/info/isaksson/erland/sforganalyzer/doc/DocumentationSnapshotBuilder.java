package info.isaksson.erland.sforganalyzer.doc;

import info.isaksson.erland.sforganalyzer.analysis.AnalysisResult;
import info.isaksson.erland.sforganalyzer.analysis.RecursionRisk;
import info.isaksson.erland.sforganalyzer.analysis.SharingNotice;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.ExecutionPath;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.model.ApexMethod;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import info.isaksson.erland.sforganalyzer.model.CallSite;
import info.isaksson.erland.sforganalyzer.model.DmlOperation;
import info.isaksson.erland.sforganalyzer.model.SoqlQuery;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Copies the facts a documentation generator needs out of the parsed codebase and one analysis result. */
public final class DocumentationSnapshotBuilder {

    public DocumentationSnapshot build(String subject, ApexCodebase codebase, AnalysisResult analysis) {
        ApexCodebase cb = codebase == null ? ApexCodebase.empty() : codebase;

        List<DocumentationSnapshot.ClassFacts> classes = new ArrayList<>();
        for (ApexClass c : cb.allClasses()) {
            if (c.isTestClass()) continue;
            List<DocumentationSnapshot.MethodFacts> methods = new ArrayList<>();
            for (ApexMethod m : c.methods) {
                if (m.testMethod) continue;
                methods.add(new DocumentationSnapshot.MethodFacts(m.signature(), m.docComment,
                        dml(m.dmlOperations), soql(m.soqlQueries), calls(m.callSites)));
            }
            classes.add(new DocumentationSnapshot.ClassFacts(c.qualifiedName, c.file,
                    c.sharing.keyword().isEmpty() ? "none" : c.sharing.keyword(), c.docComment, methods));
        }

        List<DocumentationSnapshot.TriggerFacts> triggers = new ArrayList<>();
        for (ApexTrigger t : cb.triggers) {
            triggers.add(new DocumentationSnapshot.TriggerFacts(t.name, t.objectName,
                    t.contexts.stream().map(TriggerContext::label).collect(Collectors.toList()),
                    dml(t.dmlOperations), soql(t.soqlQueries), calls(t.callSites)));
        }

        List<DocumentationSnapshot.PathSummary> paths = new ArrayList<>();
        int entryPoints = 0;
        List<String> risks = List.of();
        List<String> sharing = List.of();
        if (analysis != null) {
            entryPoints = analysis.graph.entryPoints.size();
            for (ExecutionPath p : analysis.paths) {
                AutomationNode entry = analysis.graph.node(p.entryId).orElse(null);
                String object = entry == null ? "" : entry.targetObject;
                String context = entry == null || entry.triggerContext == null ? null : entry.triggerContext.label();
                paths.add(new DocumentationSnapshot.PathSummary(p.entryId, object, context, p.nodeIds(), p.depth(),
                        p.recursion, p.truncated, p.stopReason.name()));
            }
            risks = analysis.recursionRisks.stream().map(RecursionRisk::toString).collect(Collectors.toList());
            sharing = analysis.sharingNotices.stream().map(SharingNotice::toString).collect(Collectors.toList());
        }

        return new DocumentationSnapshot(subject, entryPoints, classes, triggers, paths,
                analysis == null ? List.of() : analysis.objectDependencies, risks, sharing);
    }

    private static List<String> dml(List<DmlOperation> ops) {
        return ops.stream().map(DmlOperation::toString).collect(Collectors.toList());
    }

    private static List<String> soql(List<SoqlQuery> qs) {
        return qs.stream().map(q -> q.query).collect(Collectors.toList());
    }

    private static List<String> calls(List<CallSite> cs) {
        return cs.stream().map(CallSite::toString).collect(Collectors.toList());
    }
}
