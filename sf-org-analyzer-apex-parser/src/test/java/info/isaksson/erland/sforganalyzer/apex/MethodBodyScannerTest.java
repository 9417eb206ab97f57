package info.isaksson.erland.sforganalyzer.apex;

import info.isaksson.erland.sforganalyzer.model.ApexMethod;
import info.isaksson.erland.sforganalyzer.model.ApexTrigger;
import info.isaksson.erland.sforganalyzer.model.CallSite;
import info.isaksson.erland.sforganalyzer.model.DmlKind;
import info.isaksson.erland.sforganalyzer.model.DmlOperation;
import info.isaksson.erland.sforganalyzer.model.SoqlQuery;
import info.isaksson.erland.sforganalyzer.model.SoqlQueryType;
import info.isaksson.erland.sforganalyzer.model.TriggerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MethodBodyScannerTest {

    private final ApexParser parser = new ApexParser();

    @Test
    void dmlStatementsAreRecordedInSourceOrder() {
        String src = "public class Svc {\n"
                + "    public void save(List<Account> accounts, Contact c) {\n"
                + "        insert accounts;\n"
                + "        update c;\n"
                + "        delete [SELECT Id FROM Lead WHERE IsConverted = true];\n"
                + "    }\n"
                + "}\n";

        ApexMethod m = method(src);
        List<DmlOperation> dml = m.dmlOperations;

        assertEquals(List.of(DmlKind.INSERT, DmlKind.UPDATE, DmlKind.DELETE),
                dml.stream().map(d -> d.kind).collect(Collectors.toList()));
        assertEquals(List.of("Account", "Contact", "Lead"),
                dml.stream().map(d -> d.targetObject).collect(Collectors.toList()));
        assertEquals(List.of(true, false, true),
                dml.stream().map(d -> d.bulk).collect(Collectors.toList()));
        assertEquals(List.of(3, 4, 5),
                dml.stream().map(d -> d.line).collect(Collectors.toList()));
        assertEquals(List.of(9, 9, 9),
                dml.stream().map(d -> d.column).collect(Collectors.toList()));
        assertEquals(1, m.soqlQueries.size());
        assertEquals(16, m.soqlQueries.get(0).column);
    }

    @Test
    void localDeclarationsAndFieldsInformTargetObject() {
        String src = "public class Svc {\n"
                + "    public void run() {\n"
                + "        List<Opportunity> opps = new List<Opportunity>();\n"
                + "        Case single = cases[0];\n"
                + "        upsert opps;\n"
                + "        update single;\n"
                + "        merge this.primary duplicate;\n"
                + "        insert accountList;\n"
                + "        delete cases[0];\n"
                + "    }\n"
                + "    private Account primary;\n"
                + "    private Case[] cases;\n"
                + "}\n";

        List<DmlOperation> dml = method(src).dmlOperations;

        assertEquals("Opportunity", dml.get(0).targetObject);
        assertTrue(dml.get(0).bulk);
        assertEquals("Case", dml.get(1).targetObject);
        assertFalse(dml.get(1).bulk);
        assertEquals(DmlKind.MERGE, dml.get(2).kind);
        assertEquals("Account", dml.get(2).targetObject, "fields declared after the method still count");
        assertEquals(DmlOperation.UNKNOWN_OBJECT, dml.get(3).targetObject);
        assertTrue(dml.get(3).bulk, "collection-suffixed names are bulk by heuristic");
        assertEquals("Case", dml.get(4).targetObject);
        assertFalse(dml.get(4).bulk, "an indexed element is a single record");
    }

    @Test
    void dmlOnASingleAssetIsNotBulk() {
        String src = "public class AssetService {\n"
                + "    public void save(Asset a, List<Asset> many) {\n"
                + "        update a;\n"
                + "        update many;\n"
                + "        insert assetSet;\n"
                + "        insert asset;\n"
                + "    }\n"
                + "}\n";

        ApexMethod m = method(src);

        assertFalse(m.parameters.get(0).isCollection());
        assertEquals(List.of("Asset", "Asset", DmlOperation.UNKNOWN_OBJECT, DmlOperation.UNKNOWN_OBJECT),
                m.dmlOperations.stream().map(d -> d.targetObject).collect(Collectors.toList()));
        assertEquals(List.of(false, true, true, false),
                m.dmlOperations.stream().map(d -> d.bulk).collect(Collectors.toList()));
    }

    @Test
    void inlineSoqlReferencesFromAndSubqueryObjects() {
        String src = "public class Q {\n"
                + "    public void q() {\n"
                + "        List<Account> a = [SELECT Id FROM Account];\n"
                + "        List<Account> b = [\n"
                + "            SELECT Id, (SELECT Id FROM Contacts) FROM Account WHERE Id IN :ids\n"
                + "        ];\n"
                + "        Integer n = [SELECT COUNT() FROM Contact];\n"
                + "    }\n"
                + "}\n";

        List<SoqlQuery> soql = method(src).soqlQueries;

        assertEquals(3, soql.size());
        assertEquals("SELECT Id FROM Account", soql.get(0).query);
        assertEquals(List.of("Account"), soql.get(0).referencedObjects);
        assertEquals(3, soql.get(0).line);
        assertEquals(List.of("Account", "Contacts"), soql.get(1).referencedObjects);
        assertEquals(4, soql.get(1).line);
        assertEquals(SoqlQueryType.RELATIONSHIP, soql.get(1).queryType());
        assertTrue(soql.get(1).hasBindVariables());
        assertEquals(SoqlQueryType.AGGREGATE, soql.get(2).queryType());
        assertFalse(soql.get(2).dynamic);
    }

    @Test
    void databaseClassDmlAndDynamicQueries() {
        String src = "public class Dyn {\n"
                + "    public void go(Map<Id, Opportunity> opps) {\n"
                + "        Database.update(opps.values(), false);\n"
                + "        List<SObject> rows = Database.query('SELECT Id FROM Case WHERE Status = :s');\n"
                + "    }\n"
                + "}\n";

        ApexMethod m = method(src);

        assertEquals(1, m.dmlOperations.size());
        DmlOperation d = m.dmlOperations.get(0);
        assertEquals(DmlKind.UPDATE, d.kind);
        assertEquals("Opportunity", d.targetObject);
        assertTrue(d.bulk);
        assertTrue(d.viaDatabaseClass);

        assertEquals(1, m.soqlQueries.size());
        assertTrue(m.soqlQueries.get(0).dynamic);
        assertEquals(List.of("Case"), m.soqlQueries.get(0).referencedObjects);
        assertTrue(m.callSites.isEmpty(), "platform calls are not call sites: " + m.callSites);
    }

    @Test
    void callSitesResolveQualifiersAndSkipBuiltins() {
        String src = "public class Caller {\n"
                + "    private AccountService svc = new AccountService();\n"
                + "    public void run(List<Account> accs) {\n"
                + "        AccountService.validateAccounts(accs);\n"
                + "        svc.process(accs);\n"
                + "        helper();\n"
                + "        new ContactService().sync();\n"
                + "        System.debug('x');\n"
                + "        accs.add(new Account());\n"
                + "        String s = String.valueOf(1);\n"
                + "        if (accs.isEmpty()) return;\n"
                + "    }\n"
                + "    private void helper() {}\n"
                + "}\n";

        List<CallSite> calls = method(src).callSites;

        assertEquals(List.of("validateAccounts", "process", "helper", "sync"),
                calls.stream().map(c -> c.calleeName).collect(Collectors.toList()));
        assertEquals(List.of("AccountService", "AccountService", "Caller", "ContactService"),
                calls.stream().map(c -> c.resolvedClass).collect(Collectors.toList()));
        assertEquals("svc", calls.get(1).qualifier);
        assertEquals(6, calls.get(2).line);
        assertEquals(9, calls.get(2).column);
    }

    @Test
    void innerClassCallsResolveAgainstQualifiedOwner() {
        String src = "public class Outer {\n"
                + "    public class Inner {\n"
                + "        void a() { b(); }\n"
                + "        void b() {}\n"
                + "    }\n"
                + "}\n";

        ApexMethod a = parser.parse("Outer.cls", src).classes.get(0).innerClasses.get(0).methods.get(0);
        assertEquals("Outer.Inner", a.callSites.get(0).resolvedClass);
    }

    @Test
    void triggerBodyIsScanned() {
        String src = "/** Account automation. */\n"
                + "trigger AccountTrigger on Account (before insert, after update) {\n"
                + "    AccountTriggerHandler handler = new AccountTriggerHandler();\n"
                + "    handler.onBeforeInsert(Trigger.new);\n"
                + "    update Trigger.old;\n"
                + "}\n";

        ApexParseResult r = parser.parse("triggers/AccountTrigger.trigger", src);
        assertTrue(r.diagnostics.isEmpty(), "Unexpected diagnostics: " + r.diagnostics);
        ApexTrigger t = r.triggers.get(0);

        assertEquals("AccountTrigger", t.name);
        assertEquals("Account", t.objectName);
        assertEquals(List.of(TriggerContext.BEFORE_INSERT, TriggerContext.AFTER_UPDATE), t.contexts);
        assertEquals("Account automation.", t.docComment);
        assertEquals(1, t.callSites.size());
        assertEquals("AccountTriggerHandler", t.callSites.get(0).resolvedClass);
        assertEquals("Account", t.dmlOperations.get(0).targetObject);
        assertTrue(t.dmlOperations.get(0).bulk);
    }

    @Test
    void unknownTriggerEventIsDiagnosed() {
        ApexParseResult r = parser.parse("T.trigger", "trigger T on Lead (before undelete, after insert) { }");
        assertEquals(List.of(TriggerContext.AFTER_INSERT), r.triggers.get(0).contexts);
        assertEquals(1, r.diagnostics.size());
    }

    private ApexMethod method(String src) {
        ApexParseResult r = parser.parse("Test.cls", src);
        assertTrue(r.diagnostics.isEmpty(), "Unexpected diagnostics: " + r.diagnostics);
        return r.classes.get(0).methods.get(0);
    }
}
