package org.rakuonjava.runtime;

/**
 * Sentinel returned by {@link RuntimeIterator#pullOne()} once a producer is exhausted.
 * It is never stored as an element.
 */
public final class IterationEnd {
    public static final IterationEnd END = new IterationEnd();

    private IterationEnd() {
    }

    @Override
    public String toString() {
        return "IterationEnd";
    }
}
