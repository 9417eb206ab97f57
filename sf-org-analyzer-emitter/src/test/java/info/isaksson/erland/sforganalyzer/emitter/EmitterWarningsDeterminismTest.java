package info.isaksson.erland.sforganalyzer.emitter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterWarningsDeterminismTest {

    @Test
    void orderDoesNotDependOnEmissionOrder() {
        EmitterWarnings first = new EmitterWarnings();
        first.warn("UNRESOLVED_TARGET", "Edge target is not in the graph", "from", "flow:Account:B", "to", "apex:X:run");
        first.warn("UNRESOLVED_TARGET", "Edge target is not in the graph", "from", "flow:Account:A", "to", "apex:X:run");
        first.warn("EMPTY_DIAGRAM", "Nothing to draw");

        EmitterWarnings second = new EmitterWarnings();
        second.warn("EMPTY_DIAGRAM", "Nothing to draw");
        second.warn("UNRESOLVED_TARGET", "Edge target is not in the graph", Map.of("to", "apex:X:run", "from", "flow:Account:A"));
        second.warn("UNRESOLVED_TARGET", "Edge target is not in the graph", "from", "flow:Account:B", "to", "apex:X:run");

        List<EmitterWarning> a = first.toDeterministicList();
        List<EmitterWarning> b = second.toDeterministicList();
        assertEquals(3, a.size());
        assertEquals("EMPTY_DIAGRAM", a.get(0).code);
        assertTrue(a.get(0).context.isEmpty());
        assertEquals("flow:Account:A", a.get(1).context.get("from"));
        assertEquals("flow:Account:B", a.get(2).context.get("from"));
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).code, b.get(i).code);
            assertEquals(a.get(i).context, b.get(i).context);
        }
    }

    @Test
    void listIsReadOnly() {
        EmitterWarnings w = new EmitterWarnings();
        assertTrue(w.isEmpty());
        w.warn("X", "x");
        assertFalse(w.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> w.toDeterministicList().clear());
    }
}
