package com.klinevault.data.fcp;

import com.klinevault.core.error.DataSourceException;
import com.klinevault.core.error.TransportException;
import com.klinevault.core.model.Bar;
import com.klinevault.data.resilience.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collapses concurrent loads of the same partition into one.
 *
 * The first caller for a key becomes the leader and runs the loader on its own thread.
 * Callers arriving while it runs wait on the leader's future and get the same result or error.
 * The entry is removed when the leader finishes, so later callers start a new load.
 */
public class InFlightRequests {

    private static final Logger log = LoggerFactory.getLogger(InFlightRequests.class);

    @FunctionalInterface
    public interface Loader {
        List<Bar> load() throws DataSourceException;
    }

    private final ConcurrentHashMap<PartitionKey, CompletableFuture<List<Bar>>> inFlight = new ConcurrentHashMap<>();

    public List<Bar> execute(PartitionKey key, Deadline deadline, Loader loader) throws DataSourceException {
        CompletableFuture<List<Bar>> mine = new CompletableFuture<>();
        CompletableFuture<List<Bar>> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight load of {}", key);
            return await(key, existing, deadline);
        }

        try {
            List<Bar> result = loader.load();
            mine.complete(result);
            return result;
        } catch (DataSourceException | RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Number of loads currently running.
     */
    public int size() {
        return inFlight.size();
    }

    private static List<Bar> await(PartitionKey key, CompletableFuture<List<Bar>> future, Deadline deadline)
            throws DataSourceException {
        try {
            if (deadline.isBounded()) {
                return future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DataSourceException dse) {
                throw dse;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Load of " + key + " failed", cause);
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Kind.TIMEOUT,
                "Deadline exceeded waiting for in-flight load of " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.Kind.CONNECTION_FAILED,
                "Interrupted waiting for in-flight load of " + key, e);
        }
    }
}
