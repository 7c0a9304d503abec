package attesta.coordinator.dispatch;

import attesta.coordinator.exception.DispatchFailureException;
import attesta.coordinator.model.WorkerStatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs worker RPC calls off the caller's thread, each bounded by a timeout.
 *
 * A call that exceeds its timeout completes its future exceptionally; the
 * underlying RPC is left to finish (or hang) on its own thread and its result
 * is discarded.
 */
public class ComputeDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ComputeDispatcher.class);

    private final WorkerClient client;
    private final ExecutorService executor;
    private final Duration submitTimeout;
    private final Duration statusTimeout;

    public ComputeDispatcher(WorkerClient client, Duration submitTimeout, Duration statusTimeout) {
        this.client = client;
        this.submitTimeout = submitTimeout;
        this.statusTimeout = statusTimeout;
        AtomicInteger seq = new AtomicInteger(1);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "attesta-rpc-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submit one partition. The future fails with {@link DispatchFailureException}.
     */
    public CompletableFuture<String> submit(DispatchRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String handle = client.submit(request);
                if (handle == null || handle.isBlank()) {
                    throw new DispatchFailureException("worker returned no handle for job " + request.jobId());
                }
                log.debug("Dispatched job {} (partition {}) -> handle {}",
                        request.jobId(), request.partition().partitionId(), handle);
                return handle;
            } catch (DispatchFailureException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                throw new DispatchFailureException("dispatch of job " + request.jobId() + " failed: "
                        + e.getMessage(), e);
            }
        }, executor).orTimeout(submitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CompletableFuture<WorkerStatusReport> status(String jobHandle) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return client.status(jobHandle);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor).orTimeout(statusTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CompletableFuture<byte[]> fetchResult(String resultHandle) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return client.fetchResult(resultHandle);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor).orTimeout(statusTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Duration statusTimeout() {
        return statusTimeout;
    }

    /**
     * Strip the {@link CompletionException} wrapper from a future's failure.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
