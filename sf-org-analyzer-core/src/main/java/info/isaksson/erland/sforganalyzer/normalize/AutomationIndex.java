package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.diag.Diagnostics;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.metadata.FlowMetadata;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.metadata.ProcessBuilderMetadata;
import info.isaksson.erland.sforganalyzer.metadata.WorkflowRuleMetadata;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.model.CallSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-to-identifier lookup shared by the normalizers.
 *
 * <p>Declarative automations are referenced by API name only, so the index maps names to the identifiers
 * their own normalizer will produce. Apex references go through the parsed class table. A reference that
 * cannot be looked up still yields an identifier; the analyzer reports it as dangling.</p>
 */
final class AutomationIndex {
    private static final Logger logger = LoggerFactory.getLogger(AutomationIndex.class);

    private final ApexCodebase codebase;
    private final Map<String, String> flows = new HashMap<>();
    private final Map<String, String> processes = new HashMap<>();
    private final Map<String, String> workflowRules = new HashMap<>();

    AutomationIndex(ApexCodebase codebase, MetadataBundle metadata, Diagnostics diagnostics) {
        this.codebase = codebase == null ? ApexCodebase.empty() : codebase;
        for (FlowMetadata f : metadata.flows) {
            register(flows, f.name, NodeIds.flow(f.object, f.name), "Flow", f.file, diagnostics);
        }
        for (ProcessBuilderMetadata p : metadata.processBuilders) {
            register(processes, p.name, NodeIds.processBuilder(p.object, p.name), "Process", p.file, diagnostics);
        }
        for (WorkflowRuleMetadata w : metadata.workflowRules) {
            register(workflowRules, w.name, NodeIds.workflowRule(w.object, w.name), "Workflow rule", w.file, diagnostics);
        }
    }

    ApexCodebase codebase() {
        return codebase;
    }

    /** Whether {@code id} is the identifier registered for {@code name}; false for duplicates that lost. */
    private boolean owns(Map<String, String> table, String name, String id) {
        return id.equals(table.get(key(name)));
    }

    boolean ownsFlow(String name, String id) {
        return owns(flows, name, id);
    }

    boolean ownsProcess(String name, String id) {
        return owns(processes, name, id);
    }

    boolean ownsWorkflowRule(String name, String id) {
        return owns(workflowRules, name, id);
    }

    String flowId(String name) {
        return flows.getOrDefault(key(name), NodeIds.flow(null, name));
    }

    String processId(String name) {
        return processes.getOrDefault(key(name), NodeIds.processBuilder(null, name));
    }

    String workflowRuleId(String name) {
        return workflowRules.getOrDefault(key(name), NodeIds.workflowRule(null, name));
    }

    /**
     * Identifier of the Apex method a call site reaches. Methods inherited from a superclass in the table
     * resolve to the declaring class.
     *
     * <p>Empty when the call should not produce an edge: unresolvable receivers, and receivers whose type came
     * from a variable but is not a parsed class (record variables such as {@code Account acc}). A type named
     * directly ({@code Handler.run()}, {@code new Handler().run()}) that is missing still yields an
     * identifier, so it surfaces as an unresolved reference.</p>
     */
    Optional<String> apexCallTarget(CallSite call, String fromClass) {
        if (call.resolvedClass == null || call.resolvedClass.isBlank()) return Optional.empty();
        Optional<ApexClass> cls = codebase.findClass(call.resolvedClass, fromClass);
        if (cls.isPresent()) {
            return Optional.of(methodId(cls.get(), call.calleeName));
        }
        boolean namedDirectly = call.qualifier.isEmpty()
                || call.qualifier.equalsIgnoreCase(call.resolvedClass)
                || call.qualifier.startsWith("(new ");
        if (!namedDirectly) {
            logger.debug("Ignoring call {}.{} on non-Apex type {}", call.qualifier, call.calleeName, call.resolvedClass);
            return Optional.empty();
        }
        return Optional.of(NodeIds.apexMethod(call.resolvedClass, call.calleeName));
    }

    /**
     * Identifier for a declarative Apex action: {@code Class.method}, or a bare class name meaning its
     * {@code @InvocableMethod}.
     */
    String apexActionTarget(String target) {
        String t = target == null ? "" : target.trim();
        int dot = t.lastIndexOf('.');
        if (dot > 0) {
            String className = t.substring(0, dot);
            String method = t.substring(dot + 1);
            return codebase.findClass(className)
                    .map(c -> methodId(c, method))
                    .orElse(NodeIds.apexMethod(className, method));
        }
        Optional<ApexClass> cls = codebase.findClass(t);
        if (cls.isEmpty()) return NodeIds.apexMethod(t, null);
        return cls.get().methods.stream()
                .filter(m -> m.hasAnnotation("InvocableMethod"))
                .findFirst()
                .map(m -> NodeIds.apexMethod(cls.get().qualifiedName, m.name))
                .orElse(NodeIds.apexMethod(cls.get().qualifiedName, null));
    }

    private String methodId(ApexClass cls, String method) {
        Set<String> seen = new HashSet<>();
        ApexClass c = cls;
        while (c != null && seen.add(c.qualifiedName.toLowerCase(Locale.ROOT))) {
            if (!c.methodsNamed(method).isEmpty()) {
                return NodeIds.apexMethod(c.qualifiedName, c.methodsNamed(method).get(0).name);
            }
            c = c.superclass == null ? null : codebase.findClass(c.superclass, c.qualifiedName).orElse(null);
        }
        return NodeIds.apexMethod(cls.qualifiedName, method);
    }

    private static void register(Map<String, String> table, String name, String id, String what, String file,
                                 Diagnostics diagnostics) {
        if (name == null || name.isBlank()) {
            diagnostics.parseError(file, 0, what + " without a name was skipped");
            return;
        }
        if (table.putIfAbsent(key(name), id) != null) {
            diagnostics.duplicate(file, 0, what + " '" + name + "' is declared more than once; keeping " + table.get(key(name)));
        }
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
