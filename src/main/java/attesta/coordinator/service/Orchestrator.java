package attesta.coordinator.service;

import attesta.coordinator.config.CoordinatorConfig;
import attesta.coordinator.dispatch.ComputeDispatcher;
import attesta.coordinator.dispatch.DispatchRequest;
import attesta.coordinator.exception.ConfigurationException;
import attesta.coordinator.external.DataAssetService;
import attesta.coordinator.metrics.MetricKind;
import attesta.coordinator.metrics.ResultMetrics;
import attesta.coordinator.model.AssetMetadata;
import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.ComputeConfig;
import attesta.coordinator.model.EnvironmentSpec;
import attesta.coordinator.model.FailureReason;
import attesta.coordinator.model.GroupSnapshot;
import attesta.coordinator.model.Job;
import attesta.coordinator.model.JobGroup;
import attesta.coordinator.model.JobStatus;
import attesta.coordinator.model.Partition;
import attesta.coordinator.model.PartitionConfig;
import attesta.coordinator.model.TerminalOutcome;
import attesta.coordinator.model.TrustPolicy;
import attesta.coordinator.model.VerificationVerdict;
import attesta.coordinator.model.WorkerStatus;
import attesta.coordinator.model.WorkerStatusReport;
import attesta.coordinator.partition.Partitioner;
import attesta.coordinator.tracker.CompletedResult;
import attesta.coordinator.tracker.JobTracker;
import attesta.coordinator.util.Jsons;
import attesta.coordinator.verify.AttestationVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts job groups, polls them to a terminal state and cancels them.
 *
 * <p>Per-job problems (dispatch errors, worker failures, rejected attestations,
 * timeouts) are absorbed into job state; only configuration and environment
 * problems surface from {@link #startGroup}, and they surface before any
 * partition is dispatched.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final JobTracker tracker;
    private final Partitioner partitioner;
    private final ComputeDispatcher dispatcher;
    private final AttestationVerifier verifier;
    private final TrustPolicy trustPolicy;
    private final EnvironmentCatalog catalog;
    private final DataAssetService dataAssets;
    private final CoordinatorConfig config;

    private final Map<String, CountDownLatch> cancellations = new ConcurrentHashMap<>();
    private final ExecutorService pollExecutor;

    public Orchestrator(JobTracker tracker,
            Partitioner partitioner,
            ComputeDispatcher dispatcher,
            AttestationVerifier verifier,
            TrustPolicy trustPolicy,
            EnvironmentCatalog catalog,
            DataAssetService dataAssets,
            CoordinatorConfig config) {
        this.tracker = tracker;
        this.partitioner = partitioner;
        this.dispatcher = dispatcher;
        this.verifier = verifier;
        this.trustPolicy = trustPolicy;
        this.catalog = catalog;
        this.dataAssets = dataAssets;
        this.config = config;
        AtomicInteger seq = new AtomicInteger(1);
        this.pollExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "attesta-poll-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Validate, partition and dispatch a new job group.
     *
     * @return the group ID; every job is DISPATCHED or FAILED(DISPATCH_FAILURE)
     */
    public String startGroup(String datasetReference,
            String algorithmReference,
            ComputeConfig computeConfig,
            String environmentName,
            PartitionConfig partitionConfig) {
        if (datasetReference == null || datasetReference.isBlank()) {
            throw new ConfigurationException("datasetReference is required");
        }
        ComputeConfig compute = computeConfig != null ? computeConfig : ComputeConfig.empty();

        // Everything that can reject the request happens before the first dispatch
        EnvironmentSpec environment = catalog.validate(environmentName, compute);
        List<String> metricNames = MetricKind.resolveAll(compute.metricsOrEmpty()).stream()
                .map(MetricKind::metricName)
                .toList();
        AssetMetadata dataset = dataAssets.resolve(datasetReference);
        if (algorithmReference != null && !algorithmReference.isBlank()) {
            dataAssets.resolve(algorithmReference);
        }
        List<Partition> partitions = partitioner.partition(dataset, partitionConfig);

        String groupId = tracker.newGroupId();
        Instant now = tracker.now();
        List<Job> jobs = new ArrayList<>();
        for (Partition partition : partitions) {
            jobs.add(Job.builder()
                    .id(tracker.newJobId())
                    .groupId(groupId)
                    .partition(partition)
                    .environmentName(environment.name())
                    .status(JobStatus.PENDING)
                    .createdAt(now)
                    .build());
        }
        JobGroup group = new JobGroup(groupId, jobs.stream().map(Job::id).toList(), now,
                datasetReference, algorithmReference, environment.name(), metricNames);
        tracker.createGroup(group, jobs);

        // Fan out: every submit is in flight before any is awaited
        List<CompletableFuture<Void>> dispatches = new ArrayList<>();
        for (Job job : jobs) {
            DispatchRequest request = new DispatchRequest(job.id(), groupId, job.partition(), environment,
                    algorithmReference, compute);
            dispatches.add(dispatcher.submit(request).handle((handle, error) -> {
                if (error == null) {
                    tracker.markDispatched(job.id(), handle, tracker.now());
                } else {
                    tracker.markFailed(job.id(), FailureReason.DISPATCH_FAILURE,
                            describe(ComputeDispatcher.unwrap(error)));
                }
                return null;
            }));
        }
        CompletableFuture.allOf(dispatches.toArray(new CompletableFuture[0])).join();

        log.info("Started group {} on {}: {} partitions of {}", groupId, environment.name(),
                jobs.size(), datasetReference);
        return groupId;
    }

    /**
     * Poll with the configured interval and timeout.
     */
    public TerminalOutcome pollGroup(String groupId) {
        return pollGroup(groupId, config.pollInterval(), config.pollTimeout());
    }

    /**
     * Query every non-terminal job each {@code interval} until all are terminal,
     * the group is cancelled, or {@code timeout} elapses. Jobs still open at the
     * deadline are failed with {@link FailureReason#TIMEOUT}.
     */
    public TerminalOutcome pollGroup(String groupId, Duration interval, Duration timeout) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("poll timeout must not be negative");
        }
        JobGroup group = tracker.group(groupId);
        List<MetricKind> requested = MetricKind.resolveAll(group.requestedMetrics());
        CountDownLatch cancelled = cancellations.computeIfAbsent(groupId, k -> new CountDownLatch(1));
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean timedOut = false;

        try {
            while (cancelled.getCount() > 0) {
                List<Job> open = tracker.nonTerminal(groupId);
                if (open.isEmpty()) {
                    break;
                }
                pollOnce(open, requested, deadline);
                if (tracker.nonTerminal(groupId).isEmpty()) {
                    break;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    timedOut = true;
                    break;
                }
                try {
                    cancelled.await(Math.min(interval.toNanos(), remaining), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Polling of group {} interrupted, cancelling open jobs", groupId);
                    cancelGroup(groupId);
                }
            }
        } finally {
            cancellations.remove(groupId, cancelled);
        }

        if (timedOut) {
            for (Job job : tracker.nonTerminal(groupId)) {
                tracker.markFailed(job.id(), FailureReason.TIMEOUT,
                        "no terminal status within " + timeout.toMillis() + "ms (last seen " + job.status() + ")");
            }
        }

        List<Job> jobs = tracker.jobs(groupId);
        boolean wasCancelled = cancelled.getCount() == 0
                || jobs.stream().anyMatch(j -> j.failureReason() == FailureReason.CANCELLED);
        TerminalOutcome outcome = new TerminalOutcome(groupId, jobs, timedOut, wasCancelled);
        log.info("Group {} polled to end: {} completed, {} failed{}{}", groupId, outcome.completedCount(),
                outcome.failedCount(), timedOut ? " (timed out)" : "", outcome.cancelled() ? " (cancelled)" : "");
        return outcome;
    }

    /**
     * Run {@link #pollGroup(String)} on a background thread.
     */
    public CompletableFuture<TerminalOutcome> pollGroupAsync(String groupId) {
        tracker.group(groupId);
        return CompletableFuture.supplyAsync(() -> pollGroup(groupId), pollExecutor)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("Background poll of group {} failed", groupId, error);
                    }
                });
    }

    /**
     * Fail every open job with {@link FailureReason#CANCELLED} and stop any poll
     * loop on the group. Calls already in flight to workers are abandoned.
     *
     * @return number of jobs cancelled
     */
    public int cancelGroup(String groupId) {
        tracker.group(groupId);
        CountDownLatch polling = cancellations.get(groupId);
        if (polling != null) {
            polling.countDown();
        }
        int count = 0;
        for (Job job : tracker.nonTerminal(groupId)) {
            if (tracker.markFailed(job.id(), FailureReason.CANCELLED, "group cancelled")) {
                count++;
            }
        }
        log.info("Cancelled group {} ({} open jobs)", groupId, count);
        return count;
    }

    public GroupSnapshot groupSnapshot(String groupId) {
        return tracker.snapshot(groupId);
    }

    /** Groups with a poll loop currently running. */
    int activePolls() {
        return cancellations.size();
    }

    // --- Polling ---

    /**
     * One status round. Waits for the round's calls no longer than the group
     * deadline; calls still outstanding then are left to finish on their own.
     */
    private void pollOnce(List<Job> open, List<MetricKind> requested, long deadline) {
        List<CompletableFuture<Void>> queries = new ArrayList<>();
        for (Job job : open) {
            if (job.workerHandle() == null) {
                continue;
            }
            queries.add(dispatcher.status(job.workerHandle())
                    .thenCompose(report -> apply(job, report, requested))
                    .exceptionally(error -> {
                        // Non-response is transient; the group deadline bounds the retries
                        log.debug("Status of job {} unavailable this round: {}", job.id(),
                                describe(ComputeDispatcher.unwrap(error)));
                        return null;
                    }));
        }
        CompletableFuture<Void> round = CompletableFuture.allOf(queries.toArray(new CompletableFuture[0]));
        try {
            round.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.debug("Poll round cut at the group deadline, {} of {} status calls outstanding",
                    queries.stream().filter(q -> !q.isDone()).count(), queries.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Poll round failed: {}", describe(ComputeDispatcher.unwrap(e)));
        }
    }

    private CompletableFuture<Void> apply(Job job, WorkerStatusReport report, List<MetricKind> requested) {
        if (report == null || report.status() == null) {
            log.warn("Worker returned an empty status for job {}", job.id());
            return CompletableFuture.completedFuture(null);
        }
        WorkerStatus status = report.status();
        switch (status) {
            case QUEUED -> {
                return CompletableFuture.completedFuture(null);
            }
            case RUNNING -> {
                if (job.status() == JobStatus.DISPATCHED) {
                    tracker.markRunning(job.id());
                }
                return CompletableFuture.completedFuture(null);
            }
            case FAILED -> {
                String error = report.error() != null ? report.error() : "worker reported failure";
                tracker.markFailed(job.id(), FailureReason.WORKER_FAILURE, error);
                return CompletableFuture.completedFuture(null);
            }
            default -> {
                return onSucceeded(job, report, requested);
            }
        }
    }

    private CompletableFuture<Void> onSucceeded(Job job, WorkerStatusReport report, List<MetricKind> requested) {
        Attestation attestation = report.attestation();
        Instant verifiedAt = tracker.now();
        VerificationVerdict verdict = verifier.verifyFor(job.id(), attestation, trustPolicy, verifiedAt);
        if (!verdict.valid()) {
            String message = report.error() != null ? verdict + " (" + report.error() + ")" : verdict.toString();
            tracker.markFailed(job.id(), FailureReason.VERIFICATION_FAILURE, message, attestation);
            return CompletableFuture.completedFuture(null);
        }

        String resultHandle = report.resultHandle();
        if (resultHandle == null || resultHandle.isBlank()) {
            complete(job, report, verdict, verifiedAt, null, requested);
            return CompletableFuture.completedFuture(null);
        }

        return dispatcher.fetchResult(resultHandle).thenAccept(bytes -> {
            String digest = attestation.resultDigest();
            if (digest != null && !digest.equalsIgnoreCase(Jsons.sha256Hex(bytes))) {
                tracker.markFailed(job.id(), FailureReason.VERIFICATION_FAILURE,
                        "result bytes do not match attested digest", attestation);
                return;
            }
            complete(job, report, verdict, verifiedAt, new String(bytes, StandardCharsets.UTF_8), requested);
        });
    }

    private void complete(Job job, WorkerStatusReport report, VerificationVerdict verdict, Instant verifiedAt,
            String output, List<MetricKind> requested) {
        Map<String, Double> metrics = ResultMetrics.derive(output, requested, report.metricsOrEmpty());
        boolean applied = tracker.markCompleted(job.id(), new CompletedResult(
                report.attestation(),
                report.resultHandle(),
                metrics,
                report.computeTimeMs(),
                output,
                verdict.confidence(),
                verifiedAt));
        if (applied) {
            log.info("Job {} completed (partition {}, confidence {})", job.id(),
                    job.partition().partitionId(), verdict.confidence());
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @Override
    public void close() {
        pollExecutor.shutdownNow();
    }
}
