package attesta.coordinator.simulation;

import attesta.coordinator.dispatch.DispatchRequest;
import attesta.coordinator.dispatch.WorkerClient;
import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.WorkerStatusReport;
import attesta.coordinator.util.Jsons;
import attesta.coordinator.verify.SignerKey;
import attesta.coordinator.verify.Signatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process TEE worker. Runs nothing; after a configurable delay it reports
 * success with a real Ed25519-signed attestation over the job and a digest
 * of the result it serves.
 *
 * <p>Per-partition misbehaviour (by partition index) can be switched on to
 * exercise the coordinator: submit errors, reported failures, jobs that never
 * finish, status calls that never answer, wrong measurements, missing
 * attestations.
 */
public final class SimulatedWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedWorkerClient.class);

    private final String signerIdentity;
    private final String measurement;
    private final KeyPair keyPair;
    private final Clock clock;

    private volatile Duration completionDelay = Duration.ZERO;
    private volatile double failRate = 0.0;

    private final Set<Integer> rejectSubmit = ConcurrentHashMap.newKeySet();
    private final Map<Integer, String> workerFailures = new ConcurrentHashMap<>();
    private final Set<Integer> neverFinish = ConcurrentHashMap.newKeySet();
    private final Set<Integer> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<Integer> withoutAttestation = ConcurrentHashMap.newKeySet();
    private final Map<Integer, String> measurementOverrides = new ConcurrentHashMap<>();
    private final Map<Integer, Map<String, Double>> reportedMetrics = new ConcurrentHashMap<>();
    private final Map<Integer, String> resultOverrides = new ConcurrentHashMap<>();

    private final Map<String, SimJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, byte[]> results = new ConcurrentHashMap<>();
    private final AtomicInteger handleSeq = new AtomicInteger(1);
    private final AtomicInteger submissions = new AtomicInteger();

    private record SimJob(DispatchRequest request, Instant submittedAt, boolean randomFailure) {
    }

    public SimulatedWorkerClient(String signerIdentity, String measurement) {
        this(signerIdentity, measurement, Clock.systemUTC());
    }

    public SimulatedWorkerClient(String signerIdentity, String measurement, Clock clock) {
        this.signerIdentity = signerIdentity;
        this.measurement = measurement;
        this.clock = clock;
        try {
            this.keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    /** Public key to register with the coordinator's key directory */
    public SignerKey signerKey() {
        return SignerKey.of(signerIdentity, keyPair.getPublic());
    }

    public String signerIdentity() {
        return signerIdentity;
    }

    public String measurement() {
        return measurement;
    }

    public int submissionCount() {
        return submissions.get();
    }

    // --- Behaviour switches ---

    public SimulatedWorkerClient completionDelay(Duration delay) {
        this.completionDelay = delay;
        return this;
    }

    /** Fraction of jobs, chosen at submit time, that report failure */
    public SimulatedWorkerClient failRate(double failRate) {
        this.failRate = failRate;
        return this;
    }

    public SimulatedWorkerClient rejectSubmit(int partitionIndex) {
        rejectSubmit.add(partitionIndex);
        return this;
    }

    public SimulatedWorkerClient failPartition(int partitionIndex, String error) {
        workerFailures.put(partitionIndex, error);
        return this;
    }

    public SimulatedWorkerClient neverFinish(int partitionIndex) {
        neverFinish.add(partitionIndex);
        return this;
    }

    public SimulatedWorkerClient unreachable(int partitionIndex) {
        unreachable.add(partitionIndex);
        return this;
    }

    public SimulatedWorkerClient withoutAttestation(int partitionIndex) {
        withoutAttestation.add(partitionIndex);
        return this;
    }

    public SimulatedWorkerClient measurement(int partitionIndex, String measurement) {
        measurementOverrides.put(partitionIndex, measurement);
        return this;
    }

    public SimulatedWorkerClient metrics(int partitionIndex, Map<String, Double> metrics) {
        reportedMetrics.put(partitionIndex, Map.copyOf(metrics));
        return this;
    }

    public SimulatedWorkerClient result(int partitionIndex, String resultJson) {
        resultOverrides.put(partitionIndex, resultJson);
        return this;
    }

    // --- Worker RPC ---

    @Override
    public String submit(DispatchRequest request) throws IOException {
        submissions.incrementAndGet();
        int index = request.partition().index();
        if (rejectSubmit.contains(index)) {
            throw new IOException("simulated worker refused partition " + request.partition().partitionId());
        }
        String handle = "sim-" + handleSeq.getAndIncrement();
        boolean randomFailure = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
        jobs.put(handle, new SimJob(request, clock.instant(), randomFailure));
        log.debug("Sim accepted job {} (partition {}) as {}", request.jobId(), index, handle);
        return handle;
    }

    @Override
    public WorkerStatusReport status(String handle) throws IOException {
        SimJob job = jobs.get(handle);
        if (job == null) {
            throw new IOException("unknown job handle " + handle);
        }
        int index = job.request().partition().index();

        if (unreachable.contains(index)) {
            try {
                Thread.sleep(Long.MAX_VALUE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("status call abandoned");
            }
        }
        if (neverFinish.contains(index)) {
            return WorkerStatusReport.running();
        }
        if (Duration.between(job.submittedAt(), clock.instant()).compareTo(completionDelay) < 0) {
            return WorkerStatusReport.running();
        }
        if (workerFailures.containsKey(index)) {
            return WorkerStatusReport.failed(workerFailures.get(index));
        }
        if (job.randomFailure()) {
            return WorkerStatusReport.failed("Simulated failure");
        }

        String resultHandle = "res-" + handle;
        byte[] result = results.computeIfAbsent(resultHandle, k -> resultFor(job.request()));
        Attestation attestation = withoutAttestation.contains(index) ? null : attest(job, result);
        long computeTime = Math.max(1, Duration.between(job.submittedAt(), clock.instant()).toMillis());
        return WorkerStatusReport.succeeded(attestation, resultHandle,
                reportedMetrics.getOrDefault(index, Map.of()), computeTime);
    }

    @Override
    public byte[] fetchResult(String resultHandle) throws IOException {
        byte[] result = results.get(resultHandle);
        if (result == null) {
            throw new IOException("unknown result handle " + resultHandle);
        }
        return result.clone();
    }

    private byte[] resultFor(DispatchRequest request) {
        int index = request.partition().index();
        String override = resultOverrides.get(index);
        if (override != null) {
            return override.getBytes(StandardCharsets.UTF_8);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("partitionId", request.partition().partitionId());
        body.put("records", request.partition().selector().describe());
        body.put("algorithm", request.algorithmReference());
        body.put("environment", request.environment().name());
        // Ten binary labels with exactly one wrong prediction: accuracy 0.9
        int[] labels = new int[10];
        int[] predictions = new int[10];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = (i + index) % 2;
            predictions[i] = i == index % labels.length ? 1 - labels[i] : labels[i];
        }
        body.put("labels", labels);
        body.put("predictions", predictions);
        return Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
    }

    private Attestation attest(SimJob job, byte[] result) {
        int index = job.request().partition().index();
        Attestation unsigned = new Attestation(
                job.request().jobId(),
                measurementOverrides.getOrDefault(index, measurement),
                signerIdentity,
                clock.instant(),
                Jsons.sha256Hex(result),
                null);
        try {
            return unsigned.withSignature(Signatures.sign(keyPair.getPrivate(), unsigned.signedPayload()));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign attestation", e);
        }
    }
}
