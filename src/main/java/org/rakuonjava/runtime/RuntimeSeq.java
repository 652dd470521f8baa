package org.rakuonjava.runtime;

import org.rakuonjava.RuntimeConfiguration;

import java.util.concurrent.ExecutorService;

/**
 * A one-shot sequence over a {@link RuntimeIterator}.
 *
 * <p>State transitions:
 * <pre>
 * FRESH --pull--> CONSUMING --end reached--> CONSUMED
 * FRESH --cache--> CACHED
 * </pre>
 * Pulling from a CONSUMED or CACHED sequence fails, and so does caching a sequence that
 * has already been pulled from. Caching a CACHED sequence returns the List stored the
 * first time.
 *
 * <p>A Seq is not Positional: binding it to an array-style target requires an explicit
 * {@link #cache()}.
 */
public class RuntimeSeq implements RuntimeIterable, PositionalBindFailover {

    private final RuntimeIterator source;
    private SeqState state = SeqState.FRESH;
    private RuntimeList cached;

    public RuntimeSeq(RuntimeIterator source) {
        this.source = source;
    }

    public static RuntimeSeq of(Object... values) {
        return new RuntimeSeq(RuntimeList.of(values).runtimeIterator());
    }

    public SeqState state() {
        return state;
    }

    @Override
    public boolean isLazy() {
        return source.isLazy();
    }

    /**
     * Produces the next value.
     *
     * @return the next value, or {@link IterationEnd#END} the first time the end is reached
     * @throws AlreadyConsumedException if the sequence is CONSUMED or CACHED
     */
    public Object pull() {
        switch (state) {
            case FRESH -> transition(SeqState.CONSUMING);
            case CONSUMING -> {
            }
            case CACHED, CONSUMED -> throw new AlreadyConsumedException(state);
            default -> throw new IllegalStateException("Unknown seq state: " + state);
        }
        Object value = source.pullOne();
        if (value == IterationEnd.END) {
            transition(SeqState.CONSUMED);
        }
        return value;
    }

    /**
     * Hands out the sequence's iterator. This is the single allowed iteration; the
     * sequence is CONSUMED once the iterator reaches its end.
     *
     * @throws AlreadyConsumedException unless the sequence is FRESH
     */
    @Override
    public RuntimeIterator runtimeIterator() {
        if (state != SeqState.FRESH) {
            throw new AlreadyConsumedException(state);
        }
        transition(SeqState.CONSUMING);
        return new RuntimeIterator() {
            private boolean done;

            @Override
            public Object pullOne() {
                if (done) {
                    return IterationEnd.END;
                }
                Object value = source.pullOne();
                if (value == IterationEnd.END) {
                    done = true;
                    transition(SeqState.CONSUMED);
                }
                return value;
            }

            @Override
            public boolean isLazy() {
                return source.isLazy();
            }
        };
    }

    /**
     * Stores every value in an immutable List. A lazy source is memoized on demand instead
     * of being drained.
     *
     * @return the stored List; the same object on every call
     * @throws AlreadyConsumedException if values were already pulled from this sequence
     */
    @Override
    public RuntimeList cache() {
        return switch (state) {
            case FRESH -> {
                // A drain that fails midway leaves the sequence CONSUMING
                transition(SeqState.CONSUMING);
                cached = RuntimeList.fromIterator(source);
                transition(SeqState.CACHED);
                yield cached;
            }
            case CACHED -> cached;
            case CONSUMING, CONSUMED -> throw new AlreadyConsumedException(state);
        };
    }

    /**
     * Same as {@link #cache()}.
     */
    public RuntimeList list() {
        return cache();
    }

    /**
     * Caches and reifies every value.
     *
     * @throws InfiniteLengthException if the source is lazy
     */
    public RuntimeList eager() {
        if (state == SeqState.FRESH && source.isLazy()) {
            throw new InfiniteLengthException("eager");
        }
        return cache().eager();
    }

    /**
     * @return an order-preserving parallel view with the default settings
     */
    public RuntimeHyperSeq hyper() {
        return hyper(HyperConfiguration.defaults());
    }

    public RuntimeHyperSeq hyper(HyperConfiguration config) {
        return hyper(config, HyperExecutors.shared());
    }

    public RuntimeHyperSeq hyper(HyperConfiguration config, ExecutorService executor) {
        return new RuntimeHyperSeq(RuntimeHyperSeq.HYPER, runtimeIterator(), config, executor);
    }

    /**
     * @return a parallel view whose results may come back in any order
     */
    public RuntimeHyperSeq race() {
        return race(HyperConfiguration.defaults());
    }

    public RuntimeHyperSeq race(HyperConfiguration config) {
        return race(config, HyperExecutors.shared());
    }

    public RuntimeHyperSeq race(HyperConfiguration config, ExecutorService executor) {
        return new RuntimeHyperSeq(RuntimeHyperSeq.RACE, runtimeIterator(), config, executor);
    }

    private void transition(SeqState next) {
        if (RuntimeConfiguration.get().isDebugSeq()) {
            System.err.println("DEBUG: Seq@" + Integer.toHexString(System.identityHashCode(this))
                    + " " + state + " -> " + next);
        }
        state = next;
    }

    @Override
    public String toString() {
        return switch (state) {
            case CACHED -> cached.toString();
            default -> "Seq(" + state + ")";
        };
    }
}
