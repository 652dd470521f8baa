package org.rakuonjava.operators;

import org.junit.jupiter.api.Test;
import org.rakuonjava.runtime.IterationEnd;
import org.rakuonjava.runtime.RuntimeArray;
import org.rakuonjava.runtime.RuntimeList;
import org.rakuonjava.runtime.RuntimeRange;
import org.rakuonjava.runtime.RuntimeScalar;
import org.rakuonjava.runtime.RuntimeSeq;
import org.rakuonjava.runtime.SeqState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FlattenerTest {

    @Test
    void nestedListsAreDescended() {
        RuntimeList nested = RuntimeList.of(1, RuntimeList.of(2, RuntimeList.of(3, 4)), 5);
        assertEquals(List.of(1, 2, 3, 4, 5), Flattener.flatten(nested).cache().values());
    }

    @Test
    void containerStopsDescent() {
        RuntimeScalar boxed = RuntimeScalar.box(RuntimeList.of(2, 3));
        RuntimeList outer = RuntimeList.of(1, boxed, 4);
        RuntimeList flat = Flattener.flatten(outer).cache();
        assertEquals(3, flat.elems());
        assertSame(boxed, flat.container(1));
    }

    @Test
    void arrayContributesItsElementsOnly() {
        RuntimeArray inner = RuntimeArray.of(RuntimeList.of(8, 9), 10);
        RuntimeList outer = RuntimeList.of(1, inner);
        RuntimeList flat = Flattener.flatten(outer).cache();
        // The inner List sits in one of the Array's Containers
        assertEquals(3, flat.elems());
        assertEquals(1, flat.get(0));
        assertInstanceOf(RuntimeList.class, flat.get(1));
        assertEquals(10, flat.get(2));
    }

    @Test
    void arrayAtTheTopIsNotDescended() {
        RuntimeArray array = RuntimeArray.of(1, RuntimeList.of(2, 3));
        RuntimeList flat = Flattener.flatten(array).cache();
        assertEquals(2, flat.elems());
        assertSame(array.container(1), flat.container(1));
    }

    @Test
    void scalarAndContainerAreOneElement() {
        assertEquals(List.of(42), Flattener.flatten(42).cache().values());
        RuntimeScalar boxed = RuntimeScalar.box(RuntimeList.of(1, 2));
        assertEquals(1, Flattener.flatten(boxed).cache().elems());
    }

    @Test
    void rangesAndSeqsAreDescended() {
        RuntimeList mixed = RuntimeList.of(new RuntimeRange(1, 3), RuntimeSeq.of(4, 5));
        assertEquals(List.of(1L, 2L, 3L, 4, 5), Flattener.flatten(mixed).cache().values());
    }

    @Test
    void emptyListsVanish() {
        RuntimeList list = RuntimeList.of(new RuntimeList(), 1, RuntimeList.of(new RuntimeList()));
        assertEquals(List.of(1), Flattener.flatten(list).cache().values());
    }

    @Test
    void lazySourceGivesLazySeq() {
        RuntimeSeq flat = Flattener.flatten(RuntimeRange.infinite(1));
        assertTrue(flat.isLazy());
        assertEquals(1L, flat.pull());
        assertEquals(2L, flat.pull());
    }

    @Test
    void nestedInfiniteRangeIsPulledOnDemand() {
        RuntimeSeq flat = Flattener.flatten(RuntimeList.of(0, RuntimeRange.infinite(1)));
        assertEquals(0, flat.pull());
        assertEquals(1L, flat.pull());
        assertNotEquals(IterationEnd.END, flat.pull());
        assertEquals(SeqState.CONSUMING, flat.state());
    }

    @Test
    void resultIsAFreshSeq() {
        RuntimeList list = RuntimeList.of(1, RuntimeList.of(2));
        RuntimeSeq first = Flattener.flatten(list);
        first.cache();
        assertEquals(List.of(1, 2), Flattener.flatten(list).cache().values());
    }
}
