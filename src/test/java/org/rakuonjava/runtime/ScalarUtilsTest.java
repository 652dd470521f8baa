package org.rakuonjava.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScalarUtilsTest {

    @Test
    void typeNames() {
        assertEquals("Any", ScalarUtils.typeName(null));
        assertEquals("Int", ScalarUtils.typeName(42L));
        assertEquals("Str", ScalarUtils.typeName("x"));
        assertEquals("List", ScalarUtils.typeName(RuntimeList.of(1, 2)));
        assertEquals("Slip", ScalarUtils.typeName(RuntimeList.EMPTY));
        assertEquals("Array", ScalarUtils.typeName(new RuntimeArray()));
        assertEquals("Seq", ScalarUtils.typeName(RuntimeSeq.of(1)));
        assertEquals("Range", ScalarUtils.typeName(new RuntimeRange(1, 2)));
        assertEquals("Scalar", ScalarUtils.typeName(RuntimeScalar.box(1)));
    }

    @Test
    void displayLooksThroughContainers() {
        assertEquals("(Any)", ScalarUtils.display(new RuntimeScalar()));
        assertEquals("7", ScalarUtils.display(RuntimeScalar.box(7)));
        assertEquals("(1 2)", ScalarUtils.display(RuntimeList.of(1, 2)));
    }

    @Test
    void valueEqualityIgnoresContainersAndIntegerWidth() {
        assertTrue(ScalarUtils.valueEquals(RuntimeScalar.box(3), 3L));
        assertTrue(ScalarUtils.valueEquals(RuntimeList.of(1, 2), RuntimeArray.of(1L, 2L)));
        assertFalse(ScalarUtils.valueEquals(RuntimeList.of(1, 2), RuntimeList.of(1, 2, 3)));
        assertFalse(ScalarUtils.valueEquals(1, "1"));
        assertTrue(ScalarUtils.valueEquals(null, new RuntimeScalar()));
    }
}
