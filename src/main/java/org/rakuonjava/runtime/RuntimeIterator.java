package org.rakuonjava.runtime;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based production protocol: each call to {@link #pullOne()} produces the next value
 * or {@link IterationEnd#END}. Once END has been returned, every later call returns END again.
 */
public interface RuntimeIterator {

    /**
     * @return the next value, or {@link IterationEnd#END} when exhausted
     */
    Object pullOne();

    /**
     * A lazy producer must not be drained eagerly; it may be infinite.
     */
    default boolean isLazy() {
        return false;
    }

    /**
     * Drains all remaining values into the target list.
     *
     * @param target the list receiving the values
     * @return the number of values added
     */
    default int pushAll(List<Object> target) {
        int count = 0;
        Object value;
        while ((value = pullOne()) != IterationEnd.END) {
            target.add(value);
            count++;
        }
        return count;
    }

    /**
     * Adapts this iterator to {@link java.util.Iterator}. The adapter pulls one value ahead.
     */
    default Iterator<Object> asJavaIterator() {
        RuntimeIterator self = this;
        return new Iterator<>() {
            private Object next;
            private boolean fetched;

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    next = self.pullOne();
                    fetched = true;
                }
                return next != IterationEnd.END;
            }

            @Override
            public Object next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("No such element in iterator.next()");
                }
                fetched = false;
                return next;
            }
        };
    }

    static RuntimeIterator empty() {
        return () -> IterationEnd.END;
    }

    /**
     * Iterates over a snapshot-free view of a Java list; the list must not shrink while iterating.
     */
    static RuntimeIterator over(List<?> values) {
        return new RuntimeIterator() {
            private int index = 0;

            @Override
            public Object pullOne() {
                if (index >= values.size()) {
                    return IterationEnd.END;
                }
                return values.get(index++);
            }
        };
    }

    static RuntimeIterator single(Object value) {
        return new RuntimeIterator() {
            private boolean done;

            @Override
            public Object pullOne() {
                if (done) {
                    return IterationEnd.END;
                }
                done = true;
                return value;
            }
        };
    }
}
