package attesta.coordinator.dispatch;

import attesta.coordinator.model.Attestation;
import attesta.coordinator.model.WorkerStatus;
import attesta.coordinator.model.WorkerStatusReport;
import attesta.coordinator.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Worker RPC over HTTP/JSON.
 *
 * POST {base}/v1/jobs - submit, answers {"jobHandle": "..."}
 * GET {base}/v1/jobs/{handle} - status report
 * GET {base}/v1/results/{handle} - raw result bytes
 */
public class HttpWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerClient.class);

    private final URI baseUri;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpWorkerClient(URI baseUri, Duration requestTimeout) {
        this.baseUri = baseUri;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String submit(DispatchRequest request) throws IOException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(resolve("/v1/jobs"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(request)))
                .build();

        HttpResponse<String> response = send(httpRequest, HttpResponse.BodyHandlers.ofString());
        JsonNode body = Jsons.mapper().readTree(response.body());
        JsonNode handle = body.get("jobHandle");
        if (handle == null || handle.isNull()) {
            throw new IOException("worker response has no jobHandle: " + response.body());
        }
        return handle.asText();
    }

    @Override
    public WorkerStatusReport status(String jobHandle) throws IOException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(resolve("/v1/jobs/" + encode(jobHandle)))
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = send(httpRequest, HttpResponse.BodyHandlers.ofString());
        return parseStatus(response.body());
    }

    /**
     * Status first, attestation second. A report whose attestation does not
     * bind comes back without one, so a SUCCEEDED job is rejected instead of
     * polled again. Any other malformed body is an {@link IOException}.
     */
    static WorkerStatusReport parseStatus(String body) throws IOException {
        JsonNode root = Jsons.mapper().readTree(body);
        if (root == null || !root.isObject()) {
            throw new IOException("worker status is not a JSON object: " + body);
        }
        ObjectNode report = ((ObjectNode) root).deepCopy();
        JsonNode attestation = report.remove("attestation");
        WorkerStatusReport parsed = Jsons.mapper().treeToValue(report, WorkerStatusReport.class);
        if (attestation == null || attestation.isNull()) {
            return parsed;
        }
        try {
            Attestation bound = Jsons.mapper().treeToValue(attestation, Attestation.class);
            return new WorkerStatusReport(parsed.status(), bound, parsed.resultHandle(), parsed.metrics(),
                    parsed.computeTimeMs(), parsed.error());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Worker sent an unreadable attestation with status {}: {}", parsed.status(), e.getMessage());
            String error = parsed.status() == WorkerStatus.SUCCEEDED
                    ? "unreadable attestation: " + e.getMessage()
                    : parsed.error();
            return new WorkerStatusReport(parsed.status(), null, parsed.resultHandle(), parsed.metrics(),
                    parsed.computeTimeMs(), error);
        }
    }

    @Override
    public byte[] fetchResult(String resultHandle) throws IOException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(resolve("/v1/results/" + encode(resultHandle)))
                .timeout(requestTimeout)
                .GET()
                .build();

        return send(httpRequest, HttpResponse.BodyHandlers.ofByteArray()).body();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException {
        HttpResponse<T> response;
        try {
            response = httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted calling " + request.uri());
        }
        if (response.statusCode() / 100 != 2) {
            throw new IOException("worker " + request.method() + " " + request.uri() + " returned "
                    + response.statusCode());
        }
        return response;
    }

    private URI resolve(String path) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
