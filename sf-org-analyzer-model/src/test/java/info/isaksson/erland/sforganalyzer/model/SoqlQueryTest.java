package info.isaksson.erland.sforganalyzer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SoqlQueryTest {

    @Test
    void classifiesQueryShapes() {
        assertEquals(SoqlQueryType.SIMPLE, q("SELECT Id, Name FROM Account").queryType());
        assertEquals(SoqlQueryType.AGGREGATE, q("SELECT COUNT() FROM Contact").queryType());
        assertEquals(SoqlQueryType.AGGREGATE, q("SELECT AccountId, SUM(Amount) FROM Opportunity GROUP BY AccountId").queryType());
        assertEquals(SoqlQueryType.RELATIONSHIP, q("SELECT Id, (SELECT Id FROM Contacts) FROM Account").queryType());
        assertEquals(SoqlQueryType.RELATIONSHIP, q("SELECT Id, Account.Name FROM Contact").queryType());
    }

    @Test
    void detectsBindVariablesOutsideStringLiterals() {
        assertTrue(q("SELECT Id FROM Account WHERE Id IN :ids").hasBindVariables());
        assertFalse(q("SELECT Id FROM Account WHERE Name = 'a:b'").hasBindVariables());
        assertFalse(q("SELECT Id FROM Account").hasBindVariables());
    }

    @Test
    void primaryObjectFallsBackToUnknown() {
        assertEquals("Account", q("SELECT Id FROM Account").primaryObject());
        assertEquals(DmlOperation.UNKNOWN_OBJECT, new SoqlQuery("SELECT", List.of(), true, 1, 1).primaryObject());
    }

    private static SoqlQuery q(String text) {
        return new SoqlQuery(text, List.of("Account"), false, 1, 1);
    }
}
