package org.rakuonjava.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * The RuntimeArray class implements the mutable Array.
 *
 * <p>Every slot holds its own Container, including slots created to fill a gap when the
 * Array grows. Values stored into an Array are always copied into freshly allocated
 * Containers; a Container of the source is never reused.
 *
 * <p>An Array assigned from a lazy producer is a {@link #LAZY_ARRAY}: it keeps the producer
 * pending and boxes each value as it is reified.
 */
public class RuntimeArray implements MutablePositional {

    public static final int PLAIN_ARRAY = 0;
    public static final int LAZY_ARRAY = 1;

    // PLAIN_ARRAY or LAZY_ARRAY
    int type;
    // One Container per slot
    List<RuntimeScalar> elements;
    // Pending lazy producer, only set for LAZY_ARRAY
    private RuntimeIterator todo;

    // Constructor
    public RuntimeArray() {
        type = PLAIN_ARRAY;
        elements = new ArrayList<>();
    }

    /**
     * Builds an Array from comma operands, each value boxed into a fresh Container.
     *
     * @param values the comma operands
     */
    public static RuntimeArray of(Object... values) {
        return new RuntimeArray().assign(Arguments.comma(values));
    }

    /**
     * Removes and returns the value of the last element.
     *
     * @param runtimeArray The array to pop the last value from
     * @return The value of the last element
     * @throws EmptyCollectionException if the array is empty
     */
    public static Object pop(RuntimeArray runtimeArray) {
        return switch (runtimeArray.type) {
            case PLAIN_ARRAY -> {
                if (runtimeArray.elements.isEmpty()) {
                    throw new EmptyCollectionException("pop");
                }
                yield runtimeArray.elements.remove(runtimeArray.elements.size() - 1).get();
            }
            case LAZY_ARRAY -> throw new InfiniteLengthException("pop");
            default -> throw new IllegalStateException("Unknown array type: " + runtimeArray.type);
        };
    }

    /**
     * Removes and returns the value of the first element.
     *
     * @param runtimeArray The array to shift the first value from
     * @return The value of the first element
     * @throws EmptyCollectionException if the array is empty
     */
    public static Object shift(RuntimeArray runtimeArray) {
        return switch (runtimeArray.type) {
            case PLAIN_ARRAY -> {
                if (runtimeArray.elements.isEmpty()) {
                    throw new EmptyCollectionException("shift");
                }
                yield runtimeArray.elements.remove(0).get();
            }
            case LAZY_ARRAY -> {
                if (!runtimeArray.reifyUntil(0)) {
                    throw new EmptyCollectionException("shift");
                }
                yield runtimeArray.elements.remove(0).get();
            }
            default -> throw new IllegalStateException("Unknown array type: " + runtimeArray.type);
        };
    }

    /**
     * Adds values to the end of the array. The values follow the single argument rule:
     * a bare List adds its elements, a Container-held List adds one element.
     *
     * @param runtimeArray The array to add values to.
     * @param values       The slot shape holding the values.
     * @return The new size of the array.
     */
    public static int push(RuntimeArray runtimeArray, Arguments values) {
        return switch (runtimeArray.type) {
            case PLAIN_ARRAY -> {
                for (Object value : SingleArgumentRule.resolve(values)) {
                    runtimeArray.elements.add(RuntimeScalar.box(value));
                }
                yield runtimeArray.elements.size();
            }
            case LAZY_ARRAY -> throw new InfiniteLengthException("push");
            default -> throw new IllegalStateException("Unknown array type: " + runtimeArray.type);
        };
    }

    /**
     * Adds values to the beginning of the array, keeping their order.
     *
     * @param runtimeArray The array to add values to.
     * @param values       The slot shape holding the values.
     * @return The new size of the array; for a lazy array, the number of elements reified so far.
     */
    public static int unshift(RuntimeArray runtimeArray, Arguments values) {
        List<RuntimeScalar> boxed = new ArrayList<>();
        for (Object value : SingleArgumentRule.resolve(values)) {
            boxed.add(RuntimeScalar.box(value));
        }
        runtimeArray.elements.addAll(0, boxed);
        return runtimeArray.elements.size();
    }

    /**
     * Like {@link #push(RuntimeArray, Arguments)}, but each resolved argument that is itself
     * iterable and not in a Container contributes its elements.
     */
    public static int append(RuntimeArray runtimeArray, Arguments values) {
        return push(runtimeArray, Arguments.comma(oneLevel(values).toArray()));
    }

    /**
     * Like {@link #unshift(RuntimeArray, Arguments)} with the flattening of {@link #append}.
     */
    public static int prepend(RuntimeArray runtimeArray, Arguments values) {
        return unshift(runtimeArray, Arguments.comma(oneLevel(values).toArray()));
    }

    private static List<Object> oneLevel(Arguments values) {
        List<Object> flat = new ArrayList<>();
        for (Object value : SingleArgumentRule.resolve(values)) {
            if (value instanceof RuntimeIterable iterable && !(value instanceof RuntimeScalar)) {
                if (iterable.isLazy()) {
                    throw new InfiniteLengthException("append");
                }
                iterable.runtimeIterator().pushAll(flat);
            } else {
                flat.add(value);
            }
        }
        return flat;
    }

    /**
     * Removes {@code count} elements starting at {@code start} and inserts the replacement
     * values there, each boxed into a fresh Container.
     *
     * @param runtimeArray the array to splice
     * @param start        first position to remove; may equal the size of the array
     * @param count        number of elements to remove, clamped to the elements available
     * @param replacement  values to insert, resolved with the single argument rule
     * @return the removed values
     */
    public static RuntimeList splice(RuntimeArray runtimeArray, int start, int count, Arguments replacement) {
        return switch (runtimeArray.type) {
            case PLAIN_ARRAY -> {
                int size = runtimeArray.elements.size();
                if (start < 0 || start > size) {
                    throw new IndexOutOfRangeException(
                            "Offset argument to splice out of range. Is: " + start + ", should be in 0.." + size, start);
                }
                if (count < 0) {
                    throw new IndexOutOfRangeException(
                            "Size argument to splice out of range. Is: " + count + ", should be in 0.." + (size - start), count);
                }
                int length = Math.min(count, size - start);

                // Resolve the replacement first; a failure leaves the array untouched
                List<RuntimeScalar> inserted = new ArrayList<>();
                for (Object value : SingleArgumentRule.resolve(replacement)) {
                    inserted.add(RuntimeScalar.box(value));
                }

                List<Object> removed = new ArrayList<>(length);
                List<RuntimeScalar> window = runtimeArray.elements.subList(start, start + length);
                for (RuntimeScalar slot : window) {
                    removed.add(slot.get());
                }
                window.clear();
                runtimeArray.elements.addAll(start, inserted);
                yield RuntimeList.ofElements(removed);
            }
            case LAZY_ARRAY -> throw new InfiniteLengthException("splice");
            default -> throw new IllegalStateException("Unknown array type: " + runtimeArray.type);
        };
    }

    /**
     * Replaces the whole Array with the values of a producer.
     *
     * <p>The producer is drained before the old elements are dropped, so assigning an
     * Array to itself keeps its values. A lazy producer is kept pending instead.
     *
     * @param values the producer of the new values
     * @return this Array
     */
    private RuntimeArray store(RuntimeIterator values) {
        if (values.isLazy()) {
            this.elements = new ArrayList<>();
            this.todo = values;
            this.type = LAZY_ARRAY;
            return this;
        }
        List<Object> drained = new ArrayList<>();
        values.pushAll(drained);
        List<RuntimeScalar> slots = new ArrayList<>(drained.size());
        for (Object value : drained) {
            slots.add(RuntimeScalar.box(value));
        }
        this.elements = slots;
        this.todo = null;
        this.type = PLAIN_ARRAY;
        return this;
    }

    /**
     * Eager assignment of one operand: {@code @array = source}.
     */
    @Override
    public RuntimeArray assign(Object source) {
        return store(SingleArgumentRule.iterate(Arguments.single(source)));
    }

    /**
     * Eager assignment of a slot shape: {@code @array = a, b, c}.
     */
    public RuntimeArray assign(Arguments source) {
        return store(SingleArgumentRule.iterate(source));
    }

    /**
     * Reifies pending elements until {@code index} exists or the producer is exhausted.
     */
    boolean reifyUntil(int index) {
        while (elements.size() <= index && todo != null) {
            Object value = todo.pullOne();
            if (value == IterationEnd.END) {
                todo = null;
                type = PLAIN_ARRAY;
                break;
            }
            elements.add(RuntimeScalar.box(value));
        }
        return index < elements.size();
    }

    @Override
    public boolean isLazy() {
        return type == LAZY_ARRAY;
    }

    @Override
    public Object get(int index) {
        return container(index).get();
    }

    @Override
    public RuntimeScalar container(int index) {
        if (index < 0 || !reifyUntil(index)) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        return elements.get(index);
    }

    /**
     * Returns a Container for the slot. Past the end it is a proxy that grows the Array on
     * assignment; reading a proxy before assignment yields the undefined value.
     *
     * @param index 0-based position
     * @return the slot's Container or a growing proxy
     */
    public RuntimeScalar lvalue(int index) {
        if (index < 0) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        if (reifyUntil(index)) {
            return elements.get(index);
        }
        return new RuntimeArrayProxyEntry(this, index);
    }

    /**
     * Assigns into the slot's Container. Writing past the end grows the Array and fills the
     * gap with empty Containers.
     *
     * @param index 0-based position
     * @param value the value to store
     * @return the slot's Container
     */
    @Override
    public RuntimeScalar set(int index, Object value) {
        if (index < 0) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        if (!reifyUntil(index)) {
            while (elements.size() <= index) {
                elements.add(new RuntimeScalar());
            }
        }
        return elements.get(index).set(value);
    }

    public boolean exists(int index) {
        return index >= 0 && reifyUntil(index);
    }

    @Override
    public int elems() {
        return switch (type) {
            case PLAIN_ARRAY -> elements.size();
            case LAZY_ARRAY -> throw new InfiniteLengthException("elems");
            default -> throw new IllegalStateException("Unknown array type: " + type);
        };
    }

    @Override
    public int push(Arguments values) {
        return push(this, values);
    }

    public int push(Object... values) {
        return push(this, Arguments.of(values));
    }

    @Override
    public int unshift(Arguments values) {
        return unshift(this, values);
    }

    public int unshift(Object... values) {
        return unshift(this, Arguments.of(values));
    }

    public int append(Object... values) {
        return append(this, Arguments.of(values));
    }

    public int prepend(Object... values) {
        return prepend(this, Arguments.of(values));
    }

    @Override
    public Object pop() {
        return pop(this);
    }

    @Override
    public Object shift() {
        return shift(this);
    }

    @Override
    public RuntimeList splice(int start, int count, Arguments replacement) {
        return splice(this, start, count, replacement);
    }

    @Override
    public void clear() {
        this.elements = new ArrayList<>();
        this.todo = null;
        this.type = PLAIN_ARRAY;
    }

    /**
     * @return the element values with Containers removed
     */
    public List<Object> values() {
        List<Object> result = new ArrayList<>(elems());
        for (RuntimeScalar slot : elements) {
            result.add(slot.get());
        }
        return result;
    }

    /**
     * Returns an immutable List holding this Array's Containers, so assignments through
     * either are visible in both.
     */
    public RuntimeList list() {
        if (type == LAZY_ARRAY) {
            return RuntimeList.fromIterator(runtimeIterator());
        }
        return RuntimeList.ofElements(new ArrayList<>(elements));
    }

    @Override
    public RuntimeIterator runtimeIterator() {
        return new RuntimeArrayIterator();
    }

    /**
     * Converts the array to its display form, e.g. {@code [1 2 3]}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(ScalarUtils.display(elements.get(i)));
        }
        if (type == LAZY_ARRAY) {
            sb.append(elements.isEmpty() ? "..." : " ...");
        }
        return sb.append(']').toString();
    }

    /**
     * Yields the slot Containers in order, reifying pending elements as it goes.
     */
    private class RuntimeArrayIterator implements RuntimeIterator {
        private int currentIndex = 0;

        @Override
        public Object pullOne() {
            if (!reifyUntil(currentIndex)) {
                return IterationEnd.END;
            }
            return elements.get(currentIndex++);
        }

        @Override
        public boolean isLazy() {
            return type == LAZY_ARRAY;
        }
    }
}
