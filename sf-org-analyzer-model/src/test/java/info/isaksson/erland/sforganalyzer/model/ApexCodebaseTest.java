package info.isaksson.erland.sforganalyzer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ApexCodebaseTest {

    @Test
    void lookupIsCaseInsensitiveAndFindsNestedClasses() {
        ApexClass inner = cls("Helper", "AccountService.Helper", List.of());
        ApexClass outer = cls("AccountService", null, List.of(inner));
        ApexClass other = cls("ContactService", null, List.of());

        ApexCodebase codebase = new ApexCodebase(List.of(other, outer), List.of());

        assertEquals("AccountService", codebase.classes.get(0).name, "classes are sorted by name");
        assertSame(outer, codebase.findClass("accountservice").orElseThrow());
        assertSame(inner, codebase.findClass("AccountService.Helper").orElseThrow());
        assertSame(inner, codebase.findClass("Helper", "AccountService").orElseThrow());
        assertTrue(codebase.findClass("Helper").isEmpty());
        assertEquals(3, codebase.allClasses().size());
    }

    private static ApexClass cls(String name, String qualified, List<ApexClass> inner) {
        return new ApexClass(name, qualified, ApexTypeKind.CLASS, List.of("public"), SharingMode.WITH_SHARING,
                null, List.of(), List.of(), List.of(), List.of(), inner, null, name + ".cls", 1);
    }
}
