package io.timeandspace.optionmap;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Tuple2Test {

    @Test
    void testEntryContract() {
        Tuple2<String, Integer> t = Tuple2.of("k", 1);
        assertEquals(Map.entry("k", 1), t);
        assertEquals(t, Map.entry("k", 1));
        assertEquals(Map.entry("k", 1).hashCode(), t.hashCode());
        assertEquals("k=1", t.toString());
        assertThrows(UnsupportedOperationException.class, () -> t.setValue(2));
        assertThrows(NullPointerException.class, () -> Tuple2.of(null, 1));
    }

    @Test
    void testCopyOf() {
        Tuple2<String, Integer> t = Tuple2.of("k", 1);
        assertSame(t, Tuple2.copyOf(t));
        assertEquals(t, Tuple2.copyOf(Map.entry("k", 1)));
    }
}
