package io.caliban4j.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SweepExpanderTest {

    @Test
    void scalarConfigShouldExpandToItself() {
        assertEquals(List.of(Map.of("a", 1, "b", "x")), SweepExpander.expand(Map.of("a", 1, "b", "x")));
    }

    @Test
    void listValuesShouldExpandToCartesianProduct() {
        List<Map<String, Object>> out = SweepExpander.expand(Map.of(
                "a", List.of(1, 2),
                "b", List.of("x", "y", "z")
        ));

        assertEquals(6, out.size());
        assertTrue(out.contains(Map.of("a", 2, "b", "z")));
        assertEquals(6, out.stream().distinct().count());
    }

    @Test
    void compoundKeyShouldZipValues() {
        List<Map<String, Object>> out = SweepExpander.expand(Map.of(
                "[a,b]", List.of(List.of(1, "x"), List.of(2, "y"))
        ));

        assertEquals(List.of(Map.of("a", 1, "b", "x"), Map.of("a", 2, "b", "y")), out);
    }

    @Test
    void compoundKeyWithSingleTupleShouldExpandOnce() {
        assertEquals(List.of(Map.of("a", 1, "b", 2)), SweepExpander.expand(Map.of("[a, b]", List.of(1, 2))));
    }

    @Test
    void compoundKeyArityMismatchShouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> SweepExpander.expand(Map.of("[a,b]", List.of(List.of(1, 2, 3)))));
    }

    @Test
    void emptySweepShouldExpandToNothing() {
        assertTrue(SweepExpander.expand(Map.of("a", List.of(), "b", 1)).isEmpty());
    }

    @Test
    void configListShouldConcatenateInOrder() {
        List<Map<String, Object>> out = SweepExpander.expand(List.of(
                Map.of("a", List.of(1, 2)),
                Map.of("a", 3)
        ));

        assertEquals(List.of(Map.of("a", 1), Map.of("a", 2), Map.of("a", 3)), out);
    }

    @Test
    void emptyConfigShouldExpandToOneEmptyConfig() {
        assertEquals(List.of(Map.of()), SweepExpander.expand(Map.<String, Object>of()));
    }
}
