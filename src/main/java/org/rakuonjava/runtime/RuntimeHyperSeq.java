package org.rakuonjava.runtime;

import org.rakuonjava.RuntimeConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A one-shot sequence whose per-element work may run on several threads.
 *
 * <p>The source is pulled on the calling thread, in batches of {@link HyperConfiguration#batch()}
 * elements. Each batch is a work unit; at most {@link HyperConfiguration#degree()} units run
 * at once on the executor. Every source element is processed exactly once.
 *
 * <p>A {@link #HYPER} sequence materializes its results in source order: each batch owns
 * the result slot of its index, and only the calling thread writes the slots. A
 * {@link #RACE} sequence returns results in completion order. {@link #forEach(Consumer)}
 * delivers in completion order for both.
 *
 * <p>Materialization is all-or-fail: a failing unit cancels the others and raises a single
 * {@link WorkUnitFailureException}; after {@link #cancel()} no new unit is issued and the
 * materialization fails with {@link CancellationException}.
 */
public class RuntimeHyperSeq implements RuntimeIterable, PositionalBindFailover {

    public static final int HYPER = 0;
    public static final int RACE = 1;

    private static final Stage IDENTITY = (value, out) -> out.add(value);

    // HYPER or RACE
    public final int type;
    private final RuntimeIterator source;
    private final HyperConfiguration config;
    private final ExecutorService executor;
    private final Stage stage;
    private SeqState state = SeqState.FRESH;
    private RuntimeList cached;
    private volatile boolean cancelled;

    public RuntimeHyperSeq(int type, RuntimeIterator source, HyperConfiguration config, ExecutorService executor) {
        this(type, source, config, executor, IDENTITY);
    }

    private RuntimeHyperSeq(int type, RuntimeIterator source, HyperConfiguration config,
                            ExecutorService executor, Stage stage) {
        if (type != HYPER && type != RACE) {
            throw new IllegalStateException("Unknown hyper type: " + type);
        }
        this.type = type;
        this.source = source;
        this.config = config;
        this.executor = executor;
        this.stage = stage;
    }

    /**
     * Per-element work executed inside a work unit; emits zero or more results.
     */
    @FunctionalInterface
    private interface Stage {
        void apply(Object value, List<Object> out);
    }

    public SeqState state() {
        return state;
    }

    public HyperConfiguration configuration() {
        return config;
    }

    @Override
    public boolean isLazy() {
        return false;
    }

    /**
     * Adds a mapping stage. The function receives element values with Containers removed;
     * a Slip result is spliced into the output. This sequence hands its source over to the
     * returned one and becomes CONSUMED.
     */
    public RuntimeHyperSeq map(Function<Object, Object> fn) {
        Stage previous = stage;
        return chain((value, out) -> {
            List<Object> intermediate = new ArrayList<>();
            previous.apply(value, intermediate);
            for (Object v : intermediate) {
                Object mapped = fn.apply(RuntimeScalar.decont(v));
                if (mapped instanceof RuntimeList list && list.isSlip()) {
                    out.addAll(list.values());
                } else {
                    out.add(mapped);
                }
            }
        });
    }

    /**
     * Adds a filtering stage; see {@link #map(Function)} for the hand-over.
     */
    public RuntimeHyperSeq grep(Predicate<Object> predicate) {
        Stage previous = stage;
        return chain((value, out) -> {
            List<Object> intermediate = new ArrayList<>();
            previous.apply(value, intermediate);
            for (Object v : intermediate) {
                if (predicate.test(RuntimeScalar.decont(v))) {
                    out.add(v);
                }
            }
        });
    }

    private RuntimeHyperSeq chain(Stage next) {
        requireFresh();
        state = SeqState.CONSUMED;
        return new RuntimeHyperSeq(type, source, config, executor, next);
    }

    /**
     * Stops issuing work units. A running or later materialization fails with
     * {@link CancellationException}.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Materializes every result into an immutable List.
     *
     * @throws WorkUnitFailureException if a work unit fails
     * @throws CancellationException    if the sequence was cancelled
     * @throws AlreadyConsumedException unless the sequence is FRESH
     */
    public RuntimeList toList() {
        requireFresh();
        state = SeqState.CONSUMING;
        RuntimeList result = RuntimeList.ofElements(materialize());
        state = SeqState.CONSUMED;
        return result;
    }

    /**
     * Materializes every result into a new Array, each value in a fresh Container.
     */
    public RuntimeArray toArray() {
        return new RuntimeArray().assign(toList());
    }

    /**
     * Hands each result to the consumer on the calling thread, in completion order.
     */
    public void forEach(Consumer<Object> consumer) {
        requireFresh();
        state = SeqState.CONSUMING;
        run((index, values) -> values.forEach(consumer));
        state = SeqState.CONSUMED;
    }

    @Override
    public RuntimeList cache() {
        return switch (state) {
            case FRESH -> {
                state = SeqState.CONSUMING;
                cached = RuntimeList.ofElements(materialize());
                state = SeqState.CACHED;
                yield cached;
            }
            case CACHED -> cached;
            case CONSUMING, CONSUMED -> throw new AlreadyConsumedException(state);
        };
    }

    /**
     * Materializes all results, then yields them one by one. The sequence is CONSUMED
     * once the iterator reaches its end.
     */
    @Override
    public RuntimeIterator runtimeIterator() {
        requireFresh();
        state = SeqState.CONSUMING;
        RuntimeIterator results = RuntimeIterator.over(materialize());
        return () -> {
            Object value = results.pullOne();
            if (value == IterationEnd.END) {
                state = SeqState.CONSUMED;
            }
            return value;
        };
    }

    private void requireFresh() {
        if (state != SeqState.FRESH) {
            throw new AlreadyConsumedException(state);
        }
    }

    private List<Object> materialize() {
        List<Object> out = new ArrayList<>();
        switch (type) {
            case HYPER -> {
                List<List<Object>> slots = new ArrayList<>();
                run((index, values) -> {
                    while (slots.size() <= index) {
                        slots.add(null);
                    }
                    slots.set(index, values);
                });
                for (List<Object> slot : slots) {
                    out.addAll(slot);
                }
            }
            case RACE -> run((index, values) -> out.addAll(values));
            default -> throw new IllegalStateException("Unknown hyper type: " + type);
        }
        return out;
    }

    /**
     * Receives finished batches on the calling thread.
     */
    @FunctionalInterface
    private interface BatchSink {
        void accept(int index, List<Object> values);
    }

    private record BatchResult(int index, List<Object> values) {
    }

    private void run(BatchSink sink) {
        if (source.isLazy()) {
            throw new InfiniteLengthException(type == HYPER ? "hyper" : "race");
        }
        boolean debug = RuntimeConfiguration.get().isDebugHyper();
        CompletionService<BatchResult> completion = new ExecutorCompletionService<>(executor);
        Map<Future<BatchResult>, Integer> inFlight = new LinkedHashMap<>();
        int nextIndex = 0;
        boolean exhausted = false;
        try {
            while (true) {
                while (!exhausted && !cancelled && inFlight.size() < config.degree()) {
                    List<Object> batch = nextBatch();
                    if (batch.isEmpty()) {
                        exhausted = true;
                        break;
                    }
                    int index = nextIndex++;
                    if (debug) {
                        System.err.println("DEBUG: submitting batch " + index + " (" + batch.size() + " elements)");
                    }
                    inFlight.put(completion.submit(() -> new BatchResult(index, process(batch))), index);
                }
                if (cancelled) {
                    throw new CancellationException("Parallel sequence was cancelled");
                }
                if (inFlight.isEmpty()) {
                    return;
                }
                Future<BatchResult> done = completion.take();
                int index = inFlight.remove(done);
                BatchResult result;
                try {
                    result = done.get();
                } catch (ExecutionException e) {
                    if (cancelled) {
                        throw new CancellationException("Parallel sequence was cancelled");
                    }
                    throw failure(index, e.getCause(), inFlight);
                }
                if (debug) {
                    System.err.println("DEBUG: batch " + index + " finished");
                }
                sink.accept(result.index(), result.values());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkUnitFailureException("Interrupted while waiting for work units", e);
        } finally {
            for (Future<BatchResult> future : inFlight.keySet()) {
                future.cancel(true);
            }
        }
    }

    private List<Object> nextBatch() {
        List<Object> batch = new ArrayList<>(config.batch());
        while (batch.size() < config.batch()) {
            Object value = source.pullOne();
            if (value == IterationEnd.END) {
                break;
            }
            batch.add(value);
        }
        return batch;
    }

    private List<Object> process(List<Object> batch) {
        List<Object> out = new ArrayList<>(batch.size());
        for (Object value : batch) {
            if (cancelled) {
                throw new CancellationException("Parallel sequence was cancelled");
            }
            stage.apply(value, out);
        }
        return out;
    }

    private WorkUnitFailureException failure(int index, Throwable cause, Map<Future<BatchResult>, Integer> inFlight) {
        WorkUnitFailureException failure = new WorkUnitFailureException(index, cause);
        for (Map.Entry<Future<BatchResult>, Integer> entry : inFlight.entrySet()) {
            Future<BatchResult> other = entry.getKey();
            if (!other.isDone()) {
                other.cancel(true);
                continue;
            }
            try {
                other.get();
            } catch (ExecutionException e) {
                failure.addSuppressed(e.getCause());
            } catch (InterruptedException | CancellationException e) {
                failure.addSuppressed(e);
            }
        }
        return failure;
    }

    @Override
    public String toString() {
        return (type == HYPER ? "HyperSeq(" : "RaceSeq(") + state + ")";
    }
}
