package info.isaksson.erland.sforganalyzer.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TriggerContextTest {

    @Test
    void parsesLabelVariants() {
        assertEquals(Optional.of(TriggerContext.BEFORE_INSERT), TriggerContext.parse("before insert"));
        assertEquals(Optional.of(TriggerContext.BEFORE_INSERT), TriggerContext.parse("Before   Insert"));
        assertEquals(Optional.of(TriggerContext.AFTER_UPDATE), TriggerContext.parse("AFTER_UPDATE"));
        assertEquals(Optional.of(TriggerContext.AFTER_UNDELETE), TriggerContext.parse("afterUndelete"));
        assertTrue(TriggerContext.parse("before undelete").isEmpty());
    }

    @Test
    void beforeContextsAreFlagged() {
        assertTrue(TriggerContext.BEFORE_DELETE.isBefore());
        assertFalse(TriggerContext.AFTER_INSERT.isBefore());
    }
}
