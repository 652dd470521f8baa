package org.rakuonjava.runtime;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default execution engine for parallel sequences. Callers that manage their own threads
 * pass an {@link ExecutorService} to {@code hyper}/{@code race} instead.
 */
public final class HyperExecutors {

    private HyperExecutors() {
    }

    public static ExecutorService shared() {
        return Holder.SHARED;
    }

    private static final class Holder {
        private static final AtomicInteger counter = new AtomicInteger();

        // Daemon threads so an idle pool never prevents JVM shutdown
        static final ExecutorService SHARED = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "RakuHyperWorker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
