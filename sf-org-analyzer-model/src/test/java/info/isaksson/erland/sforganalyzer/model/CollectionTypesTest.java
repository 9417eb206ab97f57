package info.isaksson.erland.sforganalyzer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CollectionTypesTest {

    @Test
    void recognizesGenericCollectionsAndArrays() {
        assertEquals(CollectionKind.LIST, CollectionTypes.kindOf("List<Account>"));
        assertEquals(CollectionKind.SET, CollectionTypes.kindOf("Set<Id>"));
        assertEquals(CollectionKind.MAP, CollectionTypes.kindOf("Map<Id, Contact>"));
        assertEquals(CollectionKind.ARRAY, CollectionTypes.kindOf("Account[]"));
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf("Account"));
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf(null));
    }

    @Test
    void recordTypesEndingInCollectionLettersAreSingleRecords() {
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf("Asset"));
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf("Offset__c"));
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf("Checklist__c"));
        assertEquals(CollectionKind.NONE, CollectionTypes.kindOf("AccountList"));
        assertEquals(CollectionKind.LIST, CollectionTypes.kindOf("list<Asset>"));
    }

    @Test
    void undeclaredOperandNamesNeedACapitalizedCollectionSuffix() {
        assertTrue(CollectionTypes.hasCollectionName("accountList"));
        assertTrue(CollectionTypes.hasCollectionName("OpportunitySet"));
        assertTrue(CollectionTypes.hasCollectionName("contactsById2Map"));
        assertFalse(CollectionTypes.hasCollectionName("Asset"));
        assertFalse(CollectionTypes.hasCollectionName("offset"));
        assertFalse(CollectionTypes.hasCollectionName("Checklist"));
        assertFalse(CollectionTypes.hasCollectionName("List"));
        assertFalse(CollectionTypes.hasCollectionName(null));
    }

    @Test
    void parameterOfARecordTypeIsNotACollection() {
        ApexParameter p = ApexParameter.of("a", "Asset");
        assertFalse(p.isCollection());
        assertEquals(CollectionKind.NONE, p.collectionKind);
        assertEquals("Asset", p.elementType);
    }

    @Test
    void elementTypeOfMapIsValueType() {
        assertEquals("Contact", CollectionTypes.elementType("Map<Id, Contact>"));
        assertEquals("Account", CollectionTypes.elementType("List<Account>"));
        assertEquals("Account", CollectionTypes.elementType("Account[]"));
        assertEquals("List<Account>", CollectionTypes.elementType("Map<String,List<Account>>"));
        assertEquals("Account", CollectionTypes.elementType("Account"));
    }

    @Test
    void parameterDerivesCollectionFacts() {
        ApexParameter p = ApexParameter.of("accounts", "List<Account>");
        assertTrue(p.isCollection());
        assertEquals(CollectionKind.LIST, p.collectionKind);
        assertEquals("Account", p.elementType);
    }
}
