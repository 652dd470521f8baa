package org.rakuonjava.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RuntimeHyperSeqTest {

    private ExecutorService executor;
    private final HyperConfiguration smallBatches = new HyperConfiguration(3, 4);

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RuntimeSeq numbers(int count) {
        return new RuntimeSeq(new RuntimeRange(1, count).runtimeIterator());
    }

    private static void jitter() {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(3));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void hyperKeepsSourceOrder() {
        RuntimeList result = numbers(100).hyper(smallBatches, executor)
                .map(x -> {
                    jitter();
                    return (Long) x * 10;
                })
                .toList();
        List<Object> expected = new ArrayList<>();
        for (long i = 1; i <= 100; i++) {
            expected.add(i * 10);
        }
        assertEquals(expected, result.values());
    }

    @Test
    void raceProducesEveryResultExactlyOnce() {
        Map<Object, AtomicInteger> calls = new ConcurrentHashMap<>();
        RuntimeList result = numbers(200).race(smallBatches, executor)
                .map(x -> {
                    calls.computeIfAbsent(x, k -> new AtomicInteger()).incrementAndGet();
                    jitter();
                    return x;
                })
                .toList();
        assertEquals(200, result.elems());
        assertEquals(200, calls.size());
        calls.values().forEach(count -> assertEquals(1, count.get()));
        List<Object> sorted = new ArrayList<>(result.values());
        sorted.sort((a, b) -> Long.compare((Long) a, (Long) b));
        assertEquals(numbers(200).cache().values(), sorted);
    }

    @Test
    void degreeLimitsConcurrentUnits() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        numbers(60).hyper(new HyperConfiguration(1, 2), executor)
                .map(x -> {
                    int now = active.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    jitter();
                    active.decrementAndGet();
                    return x;
                })
                .toList();
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void grepAndSlipResultsAreApplied() {
        RuntimeList result = numbers(6).hyper(smallBatches, executor)
                .grep(x -> (Long) x % 2 == 0)
                .map(x -> RuntimeList.of(x, x).slip())
                .toList();
        assertEquals(List.of(2L, 2L, 4L, 4L, 6L, 6L), result.values());
    }

    @Test
    void toArrayBoxesResultsInOrder() {
        RuntimeArray array = numbers(10).hyper(smallBatches, executor).toArray();
        assertEquals(10, array.elems());
        assertEquals(1L, array.get(0));
        assertEquals(10L, array.get(9));
        array.set(0, "changed");
        assertEquals("changed", array.get(0));
    }

    @Test
    void failingUnitSurfacesOneAggregatedFailure() {
        RuntimeHyperSeq seq = numbers(50).hyper(smallBatches, executor)
                .map(x -> {
                    if ((Long) x == 37L) {
                        throw new IllegalArgumentException("bad element " + x);
                    }
                    return x;
                });
        WorkUnitFailureException e = assertThrows(WorkUnitFailureException.class, seq::toList);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals("bad element 37", e.getCause().getMessage());
        assertEquals(12, e.getBatchIndex());
        assertThrows(AlreadyConsumedException.class, seq::toList);
    }

    @Test
    void cancelledSequenceNeverReturnsPartialResults() {
        RuntimeHyperSeq seq = numbers(30).hyper(smallBatches, executor);
        seq.cancel();
        assertThrows(CancellationException.class, seq::toList);
    }

    @Test
    void cancelDuringMaterializationStopsIt() {
        RuntimeHyperSeq[] holder = new RuntimeHyperSeq[1];
        holder[0] = numbers(1000).hyper(new HyperConfiguration(4, 2), executor)
                .map(x -> {
                    if ((Long) x == 1L) {
                        holder[0].cancel();
                    }
                    return x;
                });
        assertThrows(CancellationException.class, holder[0]::toList);
        assertTrue(holder[0].isCancelled());
    }

    @Test
    void forEachDeliversEveryResultOnTheCallingThread() {
        Thread caller = Thread.currentThread();
        List<Object> seen = Collections.synchronizedList(new ArrayList<>());
        numbers(25).race(smallBatches, executor).forEach(value -> {
            assertSame(caller, Thread.currentThread());
            seen.add(value);
        });
        assertEquals(25, seen.size());
    }

    @Test
    void consumeOnceLikeSeq() {
        RuntimeHyperSeq seq = numbers(5).hyper(smallBatches, executor);
        assertSame(smallBatches, seq.configuration());
        RuntimeList cached = seq.cache();
        assertSame(cached, seq.cache());
        assertEquals(SeqState.CACHED, seq.state());
        assertThrows(AlreadyConsumedException.class, seq::toList);
        assertThrows(AlreadyConsumedException.class, seq::runtimeIterator);
    }

    @Test
    void iteratingMaterializesInOrder() {
        RuntimeHyperSeq seq = numbers(7).hyper(smallBatches, executor);
        List<Object> seen = new ArrayList<>();
        for (Object value : seq) {
            seen.add(value);
        }
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L), seen);
        assertEquals(SeqState.CONSUMED, seq.state());
    }

    @Test
    void mapHandsOverTheSource() {
        RuntimeHyperSeq original = numbers(3).hyper(smallBatches, executor);
        original.map(x -> x);
        assertEquals(SeqState.CONSUMED, original.state());
        assertThrows(AlreadyConsumedException.class, () -> original.map(x -> x));
    }

    @Test
    void hyperConsumesTheSeq() {
        RuntimeSeq seq = numbers(3);
        seq.hyper(smallBatches, executor);
        assertEquals(SeqState.CONSUMING, seq.state());
        assertThrows(AlreadyConsumedException.class, seq::cache);
    }

    @Test
    void lazySourceIsRejected() {
        RuntimeSeq naturals = new RuntimeSeq(RuntimeRange.infinite(0).runtimeIterator());
        RuntimeHyperSeq seq = naturals.hyper(smallBatches, executor);
        assertThrows(InfiniteLengthException.class, seq::toList);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HyperConfiguration(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new HyperConfiguration(1, 0));
    }
}
