package info.isaksson.erland.sforganalyzer.normalize;

import info.isaksson.erland.sforganalyzer.apex.ApexBatchResult;
import info.isaksson.erland.sforganalyzer.apex.ApexParser;
import info.isaksson.erland.sforganalyzer.apex.ApexSourceBatchParser;
import info.isaksson.erland.sforganalyzer.diag.DiagnosticKind;
import info.isaksson.erland.sforganalyzer.graph.ActionKind;
import info.isaksson.erland.sforganalyzer.graph.ActionRef;
import info.isaksson.erland.sforganalyzer.graph.AutomationKind;
import info.isaksson.erland.sforganalyzer.graph.AutomationNode;
import info.isaksson.erland.sforganalyzer.metadata.AutomationAction;
import info.isaksson.erland.sforganalyzer.metadata.AutomationActionType;
import info.isaksson.erland.sforganalyzer.metadata.FlowMetadata;
import info.isaksson.erland.sforganalyzer.metadata.MetadataBundle;
import info.isaksson.erland.sforganalyzer.metadata.ProcessBuilderMetadata;
import info.isaksson.erland.sforganalyzer.metadata.WorkflowRuleMetadata;
import info.isaksson.erland.sforganalyzer.model.ApexCodebase;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AutomationNormalizerTest {

    private static final String TRIGGER = """
            trigger AccountTrigger on Account (before insert, after update) {
                AccountTriggerHandler handler = new AccountTriggerHandler();
                handler.onBeforeInsert(Trigger.new);
                MissingHandler.run();
                update Trigger.old;
            }
            """;

    private static final String HANDLER = """
            public with sharing class AccountTriggerHandler extends BaseHandler {
                public void onBeforeInsert(List<Account> accounts) {
                    List<Contact> contacts = [SELECT Id FROM Contact WHERE AccountId IN :accounts];
                    insert contacts;
                    log('done');
                }
                public void onBeforeInsert(Account single) {
                    update single;
                }
            }
            """;

    private static final String BASE = """
            public virtual class BaseHandler {
                protected void log(String message) {
                    System.debug(message);
                }
            }
            """;

    private static final String INVOCABLE = """
            public class AccountInvocable {
                @InvocableMethod
                public static void run(List<Id> ids) {
                }
            }
            """;

    private static final String TESTS = """
            @IsTest
            private class AccountTriggerTest {
                @IsTest
                static void insertsAccount() {
                    insert new Account(Name = 'x');
                }
            }
            """;

    private final AutomationNormalizer normalizer = new AutomationNormalizer();

    @Test
    void triggerBecomesOneEntryNodePerContextSharingItsLeaves() {
        NormalizedAutomations n = normalizer.normalize(codebase(), MetadataBundle.empty());

        AutomationNode before = node(n, "trigger:Account:AccountTrigger.beforeInsert");
        AutomationNode after = node(n, "trigger:Account:AccountTrigger.afterUpdate");
        assertTrue(before.entryPoint);
        assertEquals(TriggerContext.AFTER_UPDATE, after.triggerContext);
        assertEquals(before.actions, after.actions);
        assertEquals(List.of(
                        "apex:AccountTriggerHandler:onBeforeInsert",
                        "apex:MissingHandler:run",
                        "dml:Account:trigger.AccountTrigger#1"),
                targets(before));
        assertEquals(1, n.nodes.stream().filter(x -> x.id.equals("dml:Account:trigger.AccountTrigger#1")).count());
        assertEquals(2, n.count(AutomationKind.TRIGGER));
    }

    @Test
    void overloadsShareOneMethodNodeWithLineOrderedActions() {
        NormalizedAutomations n = normalizer.normalize(codebase(), MetadataBundle.empty());

        AutomationNode m = node(n, "apex:AccountTriggerHandler:onBeforeInsert");
        assertEquals("2", m.attribute("overloads"));
        assertEquals("with sharing", m.attribute("sharing"));
        assertEquals("AccountTriggerHandler.onBeforeInsert", m.name);
        assertFalse(m.entryPoint);
        assertEquals(List.of(ActionKind.SOQL, ActionKind.DML, ActionKind.INVOKE, ActionKind.DML),
                m.actions.stream().map(a -> a.kind).collect(Collectors.toList()));
        assertEquals(List.of(
                        "soql:Contact:apex.AccountTriggerHandler.onBeforeInsert#1",
                        "dml:Contact:apex.AccountTriggerHandler.onBeforeInsert#1",
                        "apex:BaseHandler:log",
                        "dml:Account:apex.AccountTriggerHandler.onBeforeInsert#2"),
                targets(m));

        AutomationNode insert = node(n, "dml:Contact:apex.AccountTriggerHandler.onBeforeInsert#1");
        assertEquals("insert", insert.attribute("operation"));
        assertEquals("true", insert.attribute("bulk"));

        assertEquals("none", node(n, "apex:BaseHandler:log").attribute("sharing"));
    }

    @Test
    void testClassesProduceNoNodes() {
        NormalizedAutomations n = normalizer.normalize(codebase(), MetadataBundle.empty());
        assertTrue(n.nodes.stream().noneMatch(x -> x.id.contains("AccountTriggerTest")));
    }

    @Test
    void declarativeAutomationsReferenceEachOtherByName() {
        MetadataBundle md = new MetadataBundle(
                List.of(
                        new FlowMetadata("Account_Flow", "Account", true, TriggerContext.AFTER_UPDATE, true,
                                List.of("ISCHANGED(Rating)"),
                                List.of(AutomationAction.of(AutomationActionType.APEX, "AccountInvocable"),
                                        AutomationAction.of(AutomationActionType.FLOW, "Sub_Flow"),
                                        AutomationAction.dml("create", "Contact"),
                                        new AutomationAction(AutomationActionType.NOTE, null, null, null, "Send email")),
                                "flows/Account_Flow.flow-meta.xml"),
                        new FlowMetadata("Sub_Flow", "Account", false, null, null, null, null, null),
                        new FlowMetadata("Old_Flow", "Account", true, TriggerContext.AFTER_INSERT, false, null, null, null),
                        new FlowMetadata("account_flow", "Contact", true, TriggerContext.AFTER_INSERT, true, null, null,
                                "flows/Dup.flow-meta.xml")),
                List.of(new ProcessBuilderMetadata("Case_Process", "Case", TriggerContext.AFTER_INSERT, true, null,
                        List.of(AutomationAction.of(AutomationActionType.WORKFLOW, "Opp_Rule")), null)),
                List.of(new WorkflowRuleMetadata("Opp_Rule", "Opportunity", TriggerContext.BEFORE_UPDATE, null, null,
                        List.of(new AutomationAction(AutomationActionType.FIELD_UPDATE, null, null, null, null)), null)));

        NormalizedAutomations n = normalizer.normalize(codebase(), md);

        AutomationNode flow = node(n, "flow:Account:Account_Flow");
        assertTrue(flow.entryPoint);
        assertEquals(List.of("ISCHANGED(Rating)"), flow.conditions);
        assertEquals(List.of("apex:AccountInvocable:run", "flow:Account:Sub_Flow", "dml:Contact:flow.Account_Flow#1"),
                targets(flow));
        assertEquals(4, flow.actions.size());
        assertFalse(flow.actions.get(3).hasTarget());
        assertEquals("insert", node(n, "dml:Contact:flow.Account_Flow#1").attribute("operation"));

        assertFalse(node(n, "flow:Account:Sub_Flow").entryPoint);
        assertTrue(n.nodes.stream().noneMatch(x -> x.id.equals("flow:Account:Old_Flow")));
        assertTrue(n.nodes.stream().noneMatch(x -> x.id.equals("flow:Contact:account_flow")));

        assertEquals(List.of("workflow:Opportunity:Opp_Rule"), targets(node(n, "process_builder:Case:Case_Process")));
        AutomationNode rule = node(n, "workflow:Opportunity:Opp_Rule");
        assertTrue(rule.entryPoint);
        assertEquals(List.of("dml:Opportunity:workflow.Opp_Rule#1"), targets(rule));

        assertEquals(1, n.diagnostics.size());
        assertEquals(DiagnosticKind.DUPLICATE_DEFINITION, n.diagnostics.get(0).kind);
        assertEquals("flows/Dup.flow-meta.xml", n.diagnostics.get(0).file);
    }

    @Test
    void unknownDeclarativeTargetsStillGetIdentifiers() {
        MetadataBundle md = new MetadataBundle(
                List.of(new FlowMetadata("F", "Lead", true, TriggerContext.BEFORE_INSERT, true, null,
                        List.of(AutomationAction.of(AutomationActionType.APEX, "Nope.go"),
                                AutomationAction.of(AutomationActionType.APEX, "AlsoMissing"),
                                AutomationAction.of(AutomationActionType.PROCESS_BUILDER, "Ghost")), null)),
                null, null);

        NormalizedAutomations n = normalizer.normalize(ApexCodebase.empty(), md);

        assertEquals(List.of("apex:Nope:go", "apex:AlsoMissing:Unknown", "process_builder:Unknown:Ghost"),
                targets(node(n, "flow:Lead:F")));
    }

    @Test
    void sameNamedAutomationsOfDifferentKindsKeepSeparateLeaves() {
        MetadataBundle md = new MetadataBundle(
                List.of(new FlowMetadata("Set_Status", "Account", true, TriggerContext.AFTER_UPDATE, true, null,
                        List.of(AutomationAction.dml("update", "Account")), "flows/Set_Status.flow-meta.xml")),
                null,
                List.of(new WorkflowRuleMetadata("Set_Status", "Account", TriggerContext.AFTER_UPDATE, null, null,
                        List.of(new AutomationAction(AutomationActionType.FIELD_UPDATE, null, null, null, null)),
                        "workflows/Account.workflow-meta.xml")));

        NormalizedAutomations n = normalizer.normalize(ApexCodebase.empty(), md);

        assertEquals(List.of("dml:Account:flow.Set_Status#1"), targets(node(n, "flow:Account:Set_Status")));
        assertEquals(List.of("dml:Account:workflow.Set_Status#1"), targets(node(n, "workflow:Account:Set_Status")));
        assertEquals("flows/Set_Status.flow-meta.xml", node(n, "dml:Account:flow.Set_Status#1").file);
        assertEquals("workflows/Account.workflow-meta.xml", node(n, "dml:Account:workflow.Set_Status#1").file);
        assertEquals(2, n.count(AutomationKind.DML_OPERATION));
    }

    @Test
    void actionsOnOneLineFollowSourceColumns() {
        Map<String, String> sources = new TreeMap<>();
        sources.put("classes/OneLiner.cls", """
                public class OneLiner {
                    public void run(List<Account> accounts) {
                        prepare(); insert accounts; List<Contact> cs = [SELECT Id FROM Contact]; audit();
                    }
                    private void prepare() {
                    }
                    private void audit() {
                    }
                }
                """);
        ApexCodebase codebase = new ApexSourceBatchParser(new ApexParser(), 1).parseSources(sources).codebase;

        AutomationNode run = node(normalizer.normalize(codebase, MetadataBundle.empty()), "apex:OneLiner:run");

        assertEquals(List.of(ActionKind.INVOKE, ActionKind.DML, ActionKind.SOQL, ActionKind.INVOKE),
                run.actions.stream().map(a -> a.kind).collect(Collectors.toList()));
        assertEquals(List.of("apex:OneLiner:prepare", "dml:Account:apex.OneLiner.run#1",
                        "soql:Contact:apex.OneLiner.run#1", "apex:OneLiner:audit"),
                targets(run));
    }

    private static ApexCodebase codebase() {
        Map<String, String> sources = new TreeMap<>();
        sources.put("triggers/AccountTrigger.trigger", TRIGGER);
        sources.put("classes/AccountTriggerHandler.cls", HANDLER);
        sources.put("classes/BaseHandler.cls", BASE);
        sources.put("classes/AccountInvocable.cls", INVOCABLE);
        sources.put("classes/AccountTriggerTest.cls", TESTS);
        ApexBatchResult r = new ApexSourceBatchParser(new ApexParser(), 1).parseSources(sources);
        assertTrue(r.diagnostics.isEmpty(), "Unexpected diagnostics: " + r.diagnostics);
        return r.codebase;
    }

    private static AutomationNode node(NormalizedAutomations n, String id) {
        return n.nodes.stream().filter(x -> x.id.equals(id)).findFirst()
                .orElseThrow(() -> new AssertionError("No node " + id + " in " +
                        n.nodes.stream().map(x -> x.id).collect(Collectors.toList())));
    }

    private static List<String> targets(AutomationNode n) {
        return n.actions.stream().filter(ActionRef::hasTarget).map(a -> a.targetId).collect(Collectors.toList());
    }
}
