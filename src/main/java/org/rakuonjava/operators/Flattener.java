package org.rakuonjava.operators;

import org.rakuonjava.runtime.IterationEnd;
import org.rakuonjava.runtime.RuntimeArray;
import org.rakuonjava.runtime.RuntimeIterable;
import org.rakuonjava.runtime.RuntimeIterator;
import org.rakuonjava.runtime.RuntimeScalar;
import org.rakuonjava.runtime.RuntimeSeq;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Recursive flattening that stops at Containers.
 *
 * <p>Any iterable value that is not held in a Container is descended into; a Container is
 * yielded as one element, whatever it holds. Every element of an Array is a Container, so
 * an Array contributes exactly its own elements and is never descended into further.
 */
public final class Flattener {

    private Flattener() {
    }

    /**
     * Flattens a value lazily.
     *
     * @param value the value to flatten
     * @return a fresh sequence over the flattened elements
     */
    public static RuntimeSeq flatten(Object value) {
        if (value instanceof RuntimeScalar) {
            return new RuntimeSeq(RuntimeIterator.single(value));
        }
        if (value instanceof RuntimeArray array) {
            return new RuntimeSeq(array.runtimeIterator());
        }
        if (value instanceof RuntimeIterable iterable) {
            return new RuntimeSeq(new FlattenIterator(iterable.runtimeIterator()));
        }
        return new RuntimeSeq(RuntimeIterator.single(value));
    }

    /**
     * Depth-first traversal with an explicit stack of iterators.
     */
    private static final class FlattenIterator implements RuntimeIterator {
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final boolean lazy;

        FlattenIterator(RuntimeIterator root) {
            this.lazy = root.isLazy();
            stack.push(new Frame(root, true));
        }

        @Override
        public Object pullOne() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                Object value = frame.iterator().pullOne();
                if (value == IterationEnd.END) {
                    stack.pop();
                    continue;
                }
                if (!frame.descend() || value instanceof RuntimeScalar) {
                    return value;
                }
                if (value instanceof RuntimeArray array) {
                    stack.push(new Frame(array.runtimeIterator(), false));
                } else if (value instanceof RuntimeIterable iterable) {
                    stack.push(new Frame(iterable.runtimeIterator(), true));
                } else {
                    return value;
                }
            }
            return IterationEnd.END;
        }

        @Override
        public boolean isLazy() {
            return lazy;
        }
    }

    // An Array frame yields its Containers without inspecting them
    private record Frame(RuntimeIterator iterator, boolean descend) {
    }
}
