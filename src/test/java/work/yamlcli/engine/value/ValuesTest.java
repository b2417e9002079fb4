package work.yamlcli.engine.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.yamlcli.engine.error.EvaluationException;

class ValuesTest {
    @Test
    void truthiness() {
        assertFalse(Values.isTruthy(null));
        assertFalse(Values.isTruthy(""));
        assertFalse(Values.isTruthy(List.of()));
        assertFalse(Values.isTruthy(0L));
        assertFalse(Values.isTruthy(Map.of()));
        assertTrue(Values.isTruthy("false"));
        assertTrue(Values.isTruthy(List.of(0)));
    }

    @Test
    void stringify() {
        assertEquals("", Values.stringify(null));
        assertEquals("true", Values.stringify(true));
        assertEquals("42", Values.stringify(42L));
        assertEquals("2.0", Values.stringify(2.0));
        assertEquals("0.25", Values.stringify(0.25));
        assertEquals("10", Values.stringify(new BigDecimal("10")));
        assertEquals("{\"a\":[1,\"b\"]}", Values.stringify(Map.of("a", List.of(1, "b"))));
    }

    @Test
    void equalityIsNumericAcrossBoxedTypes() {
        assertTrue(Values.valueEquals(1, 1L));
        assertTrue(Values.valueEquals(2L, 2.0));
        assertTrue(Values.valueEquals(List.of(1, "a"), List.of(1L, "a")));
        assertFalse(Values.valueEquals("1", 1L));
        assertFalse(Values.valueEquals(null, ""));
    }

    @Test
    void orderingIsLimitedToComparableKinds() {
        assertTrue(Values.compare(1, 2.5) < 0);
        assertTrue(Values.compare("b", "a") > 0);
        assertTrue(Values.compare(List.of(1, 2), List.of(1, 3)) < 0);
        assertTrue(Values.compare(List.of(1), List.of(1, 0)) < 0);
        assertThrows(EvaluationException.class, () -> Values.compare("a", 1));
        assertThrows(EvaluationException.class, () -> Values.compare(true, false));
    }

    @Test
    @SuppressWarnings("unchecked")
    void freezeMakesDeepReadOnlyCopies() {
        var inner = new ArrayList<Object>(List.of("x"));
        var frozen = (Map<String, Object>) Values.freeze(Map.of("list", inner));
        inner.add("y");
        assertEquals(List.of("x"), frozen.get("list"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) frozen.get("list")).add("z"));
    }
}
