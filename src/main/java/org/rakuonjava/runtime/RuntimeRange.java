package org.rakuonjava.runtime;

/**
 * An immutable integer range. A range with no upper bound is lazy: it can be indexed and
 * iterated, but asking for its length fails.
 */
public class RuntimeRange implements Positional {
    private final long start;
    private final long end;
    private final boolean infinite;

    /**
     * Constructs a range from {@code start} to {@code end}, both inclusive. An end lower
     * than the start gives an empty range.
     */
    public RuntimeRange(long start, long end) {
        this(start, end, false);
    }

    private RuntimeRange(long start, long end, boolean infinite) {
        this.start = start;
        this.end = end;
        this.infinite = infinite;
    }

    public static RuntimeRange createRange(long start, long end) {
        return new RuntimeRange(start, end);
    }

    /**
     * @return the range {@code start..Inf}
     */
    public static RuntimeRange infinite(long start) {
        return new RuntimeRange(start, Long.MAX_VALUE, true);
    }

    public long getStart() {
        return start;
    }

    public boolean isInfinite() {
        return infinite;
    }

    @Override
    public boolean isLazy() {
        return infinite;
    }

    @Override
    public Object get(int index) {
        if (index < 0 || (!infinite && (end < start || Long.compareUnsigned(index, end - start) > 0))) {
            throw new IndexOutOfRangeException(index, boundedSize());
        }
        return start + index;
    }

    @Override
    public RuntimeScalar container(int index) {
        return RuntimeScalar.readOnly(get(index));
    }

    @Override
    public int elems() {
        if (infinite) {
            throw new InfiniteLengthException("elems");
        }
        return size();
    }

    private int size() {
        if (end >= start && Long.compareUnsigned(end - start, Integer.MAX_VALUE - 1) > 0) {
            throw new InfiniteLengthException("elems");
        }
        return boundedSize();
    }

    // Element count capped at Integer.MAX_VALUE; end - start read as unsigned is exact when end >= start
    private int boundedSize() {
        if (end < start) {
            return 0;
        }
        long span = end - start;
        if (Long.compareUnsigned(span, Integer.MAX_VALUE - 1) > 0) {
            return Integer.MAX_VALUE;
        }
        return (int) span + 1;
    }

    /**
     * @return a List over this range; lazy when the range is infinite
     */
    public RuntimeList toList() {
        return RuntimeList.fromIterator(runtimeIterator());
    }

    @Override
    public RuntimeIterator runtimeIterator() {
        return new RuntimeRangeIterator();
    }

    @Override
    public String toString() {
        return start + ".." + (infinite ? "Inf" : String.valueOf(end));
    }

    /**
     * Inner class producing the integers of the range.
     */
    private class RuntimeRangeIterator implements RuntimeIterator {
        private long current = start;
        private boolean done = !infinite && end < start;

        @Override
        public Object pullOne() {
            if (done) {
                return IterationEnd.END;
            }
            long value = current;
            if (!infinite && value == end) {
                done = true;
            } else {
                current++;
            }
            return value;
        }

        @Override
        public boolean isLazy() {
            return infinite;
        }
    }
}
