package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.graph.NodeIds;
import info.isaksson.erland.sforganalyzer.model.ApexClass;
import info.isaksson.erland.sforganalyzer.model.ApexMethod;
import info.isaksson.erland.sforganalyzer.model.SharingMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One {@link AutomationKind#APEX_METHOD} node per method name of a class. Overloads share the node and
 * contribute their body facts in declaration order. Test classes and test methods are skipped.
 */
final class ApexMethodNormalizer {

    List<AutomationNode> normalize(ApexClass cls, AutomationIndex index) {
        if (cls.isTestClass()) return List.of();

        Map<String, List<ApexMethod>> byName = new LinkedHashMap<>();
        for (ApexMethod m : cls.methods) {
            if (m.testMethod) continue;
            byName.computeIfAbsent(m.name.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(m);
        }

        List<AutomationNode> out = new ArrayList<>();
        for (List<ApexMethod> overloads : byName.values()) {
            ApexMethod first = overloads.get(0);
            String owner = cls.qualifiedName + "." + first.name;
            ApexBodyActions body = new ApexBodyActions(AutomationKind.APEX_METHOD, owner, cls.file);
            for (ApexMethod m : overloads) {
                body.add(m.dmlOperations, m.soqlQueries, m.callSites, cls.qualifiedName, index);
            }

            AutomationNode.Builder b = AutomationNode.builder(NodeIds.apexMethod(cls.qualifiedName, first.name),
                            AutomationKind.APEX_METHOD)
                    .name(cls.qualifiedName + "." + first.name)
                    .attribute("class", cls.qualifiedName)
                    .attribute("sharing", sharingLabel(cls.sharing))
                    .attribute("signature", first.signature())
                    .attribute("visibility", first.visibility().name().toLowerCase(Locale.ROOT))
                    .attribute("static", String.valueOf(first.isStatic()))
                    .source(cls.file, first.line);
            if (overloads.size() > 1) b.attribute("overloads", String.valueOf(overloads.size()));
            if (first.abstractMethod) b.attribute("abstract", "true");
            body.actions().forEach(b::action);

            out.add(b.build());
            out.addAll(body.leaves());
        }
        return out;
    }

    static String sharingLabel(SharingMode mode) {
        return mode == null || mode == SharingMode.NONE ? "none" : mode.keyword();
    }
}
