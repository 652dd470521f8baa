package org.rakuonjava.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The RuntimeList class implements the immutable List and its Slip variant.
 *
 * <p>Elements are either bare values or Containers. Once an element has been produced its
 * identity never changes; the only way to change what a List shows is to assign into a
 * Container that the List holds.
 *
 * <p>A List may be backed by a pending iterator. Elements are then produced on demand and
 * memoized, so indexing a List built from an infinite producer works as long as the index
 * exists. A List built from a lazy producer reports {@link #isLazy()} until its producer is
 * exhausted, and refuses operations that need its full length.
 *
 * <p>A Slip ({@link #SLIP_LIST}) behaves exactly like a List, except that the comma operator
 * and the Array composer splice its elements into their result instead of nesting it.
 */
public class RuntimeList implements Positional {

    public static final int PLAIN_LIST = 0;
    public static final int SLIP_LIST = 1;

    /**
     * The empty Slip: contributes no element when spliced.
     */
    public static final RuntimeList EMPTY = new RuntimeList(SLIP_LIST, Collections.emptyList(), null);

    // PLAIN_LIST or SLIP_LIST
    public final int type;
    // Reified elements; only appended to while the pending iterator is drained
    final List<Object> elements;
    // Pending producer, null once fully reified
    private RuntimeIterator todo;
    private final boolean lazy;

    RuntimeList(int type, List<Object> elements, RuntimeIterator todo) {
        this.type = type;
        this.elements = elements;
        this.todo = todo;
        this.lazy = todo != null && todo.isLazy();
    }

    // Empty List
    public RuntimeList() {
        this(PLAIN_LIST, Collections.emptyList(), null);
    }

    /**
     * Builds a List with the comma operator: one element per value, Slips spliced in place.
     *
     * @param values the comma operands
     * @return the new List
     */
    public static RuntimeList of(Object... values) {
        return fromIterator(SingleArgumentRule.iterate(Arguments.comma(values)));
    }

    /**
     * Builds a List over a producer. A lazy producer is kept pending and reified on demand;
     * any other producer is drained now.
     *
     * @param iterator the producer
     * @return the new List
     */
    public static RuntimeList fromIterator(RuntimeIterator iterator) {
        return fromIterator(PLAIN_LIST, iterator);
    }

    static RuntimeList fromIterator(int type, RuntimeIterator iterator) {
        if (iterator.isLazy()) {
            return new RuntimeList(type, new ArrayList<>(), iterator);
        }
        List<Object> values = new ArrayList<>();
        iterator.pushAll(values);
        return new RuntimeList(type, values, null);
    }

    /**
     * Builds a List holding exactly the given elements; no Slip is spliced.
     */
    static RuntimeList ofElements(List<Object> values) {
        return new RuntimeList(PLAIN_LIST, values, null);
    }

    public boolean isSlip() {
        return type == SLIP_LIST;
    }

    @Override
    public boolean isLazy() {
        return lazy && todo != null;
    }

    /**
     * Returns a Slip over the same elements. Elements not produced yet are produced through
     * this List, so both share the same memoized values.
     *
     * @return a Slip
     */
    public RuntimeList slip() {
        return switch (type) {
            case SLIP_LIST -> this;
            case PLAIN_LIST -> {
                if (todo == null) {
                    yield new RuntimeList(SLIP_LIST, elements, null);
                }
                yield new RuntimeList(SLIP_LIST, new ArrayList<>(), new PositionalIterator(this));
            }
            default -> throw new IllegalStateException("Unknown list type: " + type);
        };
    }

    /**
     * Returns this value as a plain List. A Slip that escapes construction behaves as the
     * List it wraps.
     */
    public RuntimeList list() {
        return switch (type) {
            case PLAIN_LIST -> this;
            case SLIP_LIST -> todo == null
                    ? new RuntimeList(PLAIN_LIST, elements, null)
                    : new RuntimeList(PLAIN_LIST, new ArrayList<>(), new PositionalIterator(this));
            default -> throw new IllegalStateException("Unknown list type: " + type);
        };
    }

    /**
     * Produces pending elements until {@code index} exists or the producer is exhausted.
     *
     * @return true if the element at {@code index} exists
     */
    boolean reifyUntil(int index) {
        while (elements.size() <= index && todo != null) {
            Object value = todo.pullOne();
            if (value == IterationEnd.END) {
                todo = null;
                break;
            }
            elements.add(value);
        }
        return index < elements.size();
    }

    private void reifyAll(String operation) {
        if (isLazy()) {
            throw new InfiniteLengthException(operation);
        }
        if (todo != null) {
            todo.pushAll(elements);
            todo = null;
        }
    }

    /**
     * Forces every pending element.
     *
     * @return this List
     * @throws InfiniteLengthException if the List is lazy
     */
    public RuntimeList eager() {
        reifyAll("eager");
        return this;
    }

    @Override
    public Object get(int index) {
        return RuntimeScalar.decont(element(index));
    }

    @Override
    public RuntimeScalar container(int index) {
        Object element = element(index);
        if (element instanceof RuntimeScalar scalar) {
            return scalar;
        }
        return RuntimeScalar.readOnly(element);
    }

    /**
     * Returns the element as stored: a Container or a bare value.
     */
    public Object element(int index) {
        if (index < 0 || !reifyUntil(index)) {
            throw new IndexOutOfRangeException(index, elements.size());
        }
        return elements.get(index);
    }

    /**
     * Checks whether an element exists at the given index, producing pending elements as needed.
     */
    public boolean exists(int index) {
        return index >= 0 && reifyUntil(index);
    }

    @Override
    public int elems() {
        reifyAll("elems");
        return elements.size();
    }

    /**
     * @return a new List with the elements in reverse order
     */
    public RuntimeList reverse() {
        reifyAll("reverse");
        List<Object> reversed = new ArrayList<>(elements);
        Collections.reverse(reversed);
        return ofElements(reversed);
    }

    /**
     * Returns a new List rotated left by {@code n} positions; a negative {@code n} rotates right.
     */
    public RuntimeList rotate(int n) {
        reifyAll("rotate");
        List<Object> rotated = new ArrayList<>(elements);
        if (!rotated.isEmpty()) {
            Collections.rotate(rotated, -(n % rotated.size()));
        }
        return ofElements(rotated);
    }

    /**
     * @return the element values with Containers removed
     */
    public List<Object> values() {
        reifyAll("values");
        List<Object> result = new ArrayList<>(elements.size());
        for (Object element : elements) {
            result.add(RuntimeScalar.decont(element));
        }
        return result;
    }

    @Override
    public RuntimeIterator runtimeIterator() {
        if (todo == null) {
            return RuntimeIterator.over(elements);
        }
        return new PositionalIterator(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(isSlip() ? "slip(" : "(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(ScalarUtils.display(elements.get(i)));
        }
        if (todo != null) {
            sb.append(elements.isEmpty() ? "..." : " ...");
        }
        return sb.append(')').toString();
    }

    /**
     * Reads a List position by position, reifying pending elements as it goes.
     */
    private static final class PositionalIterator implements RuntimeIterator {
        private final RuntimeList list;
        private int index = 0;

        PositionalIterator(RuntimeList list) {
            this.list = list;
        }

        @Override
        public Object pullOne() {
            if (!list.reifyUntil(index)) {
                return IterationEnd.END;
            }
            return list.elements.get(index++);
        }

        @Override
        public boolean isLazy() {
            return list.isLazy();
        }
    }
}
