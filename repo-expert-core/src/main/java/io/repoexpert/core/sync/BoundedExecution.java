package io.repoexpert.core.sync;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs remote calls with a cap on how many are in flight at once.
 */
public final class BoundedExecution {

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws IOException;
    }

    private BoundedExecution() {
    }

    /**
     * Runs every call and returns the results in call order. The first failure cancels
     * the calls that have not started yet and is rethrown.
     */
    public static <T> List<T> runAll(List<RemoteCall<T>> calls, int concurrency) throws IOException {
        if (calls.isEmpty()) {
            return List.of();
        }
        int threads = Math.max(1, Math.min(concurrency, calls.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<T>> futures = new ArrayList<>(calls.size());
            for (RemoteCall<T> call : calls) {
                futures.add(executor.submit(call::call));
            }
            List<T> results = new ArrayList<>(calls.size());
            for (Future<T> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static <T> T await(Future<T> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for remote calls");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }
}
