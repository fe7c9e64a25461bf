package io.envkeeper.server.driver;

import io.envkeeper.core.driver.DriverException;
import io.envkeeper.core.driver.TimeoutExceededException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs driver calls under a hard deadline.
 * <p>
 * Semantics:
 *  - The call runs on a cached pool of daemon threads ("adapter-call-N").
 *  - If it does not finish within the deadline, the caller gets a
 *    {@link TimeoutExceededException} naming the operation.
 *  - A timed-out call is never interrupted; it keeps running on its own thread
 *    and its eventual result is dropped.
 *  - Driver exceptions are rethrown unchanged, so callers handle a timeout and
 *    the adapter's own error for the same operation in one catch clause.
 */
public final class AdapterInvoker implements AutoCloseable {
    private static final Logger log = Logger.getLogger(AdapterInvoker.class.getName());

    /** A single driver call. */
    @FunctionalInterface
    public interface DriverCall<T> {
        T call() throws DriverException;
    }

    private final ExecutorService pool;

    public AdapterInvoker() {
        AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "adapter-call-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(String operation, Duration timeout, DriverCall<T> call) throws DriverException {
        Callable<T> task = call::call;
        Future<T> f = pool.submit(task);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(false);
            log.warning(() -> operation + " did not finish within " + timeout.toMillis() + "ms");
            throw new TimeoutExceededException(operation, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(false);
            throw new IllegalStateException("interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriverException de) throw de;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    /** Same as {@link #call} for operations without a result. */
    public void run(String operation, Duration timeout, DriverCall<Void> call) throws DriverException {
        call(operation, timeout, call);
    }

    @Override
    public void close() {
        pool.shutdown();
    }
}
