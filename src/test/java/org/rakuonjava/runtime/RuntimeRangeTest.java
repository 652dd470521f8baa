package org.rakuonjava.runtime;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeRangeTest {

    @Test
    void finiteRangeIsPositional() {
        RuntimeRange range = new RuntimeRange(3, 6);
        assertEquals(4, range.elems());
        assertEquals(5L, range.get(2));
        assertThrows(IndexOutOfRangeException.class, () -> range.get(4));
        assertEquals(List.of(3L, 4L, 5L, 6L), range.toList().values());
        assertEquals("3..6", range.toString());
    }

    @Test
    void hugeFiniteRangeRefusesItsLength() {
        RuntimeRange range = new RuntimeRange(0, Long.MAX_VALUE);
        assertThrows(InfiniteLengthException.class, range::elems);
        assertEquals(0L, range.get(0));
        assertEquals(5L, range.get(5));
        assertEquals(0L, range.runtimeIterator().pullOne());

        RuntimeRange widest = new RuntimeRange(Long.MIN_VALUE, Long.MAX_VALUE);
        assertThrows(InfiniteLengthException.class, widest::elems);
        assertEquals(Long.MIN_VALUE + 1, widest.get(1));
    }

    @Test
    void largestCountableRange() {
        RuntimeRange range = new RuntimeRange(1, Integer.MAX_VALUE);
        assertEquals(Integer.MAX_VALUE, range.elems());
        assertThrows(InfiniteLengthException.class, () -> new RuntimeRange(0, Integer.MAX_VALUE).elems());
    }

    @Test
    void emptyRange() {
        RuntimeRange range = new RuntimeRange(5, 4);
        assertEquals(0, range.elems());
        assertSame(IterationEnd.END, range.runtimeIterator().pullOne());
    }

    @Test
    void infiniteRangeIsLazy() {
        RuntimeRange range = RuntimeRange.infinite(1);
        assertTrue(range.isLazy());
        assertEquals(1_000_001L, range.get(1_000_000));
        assertThrows(InfiniteLengthException.class, range::elems);
        assertEquals("1..Inf", range.toString());
    }

    @Test
    void rangeElementsAreImmutable() {
        RuntimeRange range = new RuntimeRange(1, 2);
        assertThrows(ImmutableAssignmentException.class, () -> range.container(0).set(5));
    }

    @Test
    void iteratorStaysAtEnd() {
        RuntimeIterator iterator = new RuntimeRange(1, 1).runtimeIterator();
        assertEquals(1L, iterator.pullOne());
        assertSame(IterationEnd.END, iterator.pullOne());
        assertSame(IterationEnd.END, iterator.pullOne());
    }
}
