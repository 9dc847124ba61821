package com.quantops.engine.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.WorkerDispatchException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.progress.MetricsPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reaches remote worker runtimes over their HTTP surface.
 *
 * <pre>
 * POST   {endpoint}/{kind}/start
 * POST   {endpoint}/{kind}/resume
 * GET    {endpoint}/operations/{id}
 * GET    {endpoint}/operations/{id}/metrics?cursor=N
 * DELETE {endpoint}/operations/{id}
 * </pre>
 */
public class HttpWorkerGateway implements WorkerGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerGateway.class);

    private static final TypeReference<List<Map<String, Object>>> METRICS_TYPE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpWorkerGateway(ObjectMapper objectMapper) {
        this(objectMapper, Duration.ofSeconds(10));
    }

    public HttpWorkerGateway(ObjectMapper objectMapper, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public boolean supports(WorkerRegistration worker) {
        String endpoint = worker.endpointUrl();
        return endpoint != null && (endpoint.startsWith("http://") || endpoint.startsWith("https://"));
    }

    @Override
    public void start(WorkerRegistration worker, Operation operation, JsonNode request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("operation_id", operation.operationId());
        body.put("parent_operation_id", operation.parentOperationId());
        body.set("parameters", request != null ? request : objectMapper.createObjectNode());

        send(worker, post(worker, "/" + worker.workerType().kind() + "/start", body));
        log.info("Dispatched {} to worker {}", operation.operationId(), worker.workerId());
    }

    @Override
    public void resume(WorkerRegistration worker, String operationId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("operation_id", operationId);

        send(worker, post(worker, "/" + worker.workerType().kind() + "/resume", body));
        log.info("Dispatched resume of {} to worker {}", operationId, worker.workerId());
    }

    @Override
    public void cancel(WorkerRegistration worker, String operationId, String reason) {
        String query = reason != null ? "?reason=" + URLEncoder.encode(reason, StandardCharsets.UTF_8) : "";
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(worker.endpointUrl() + "/operations/" + operationId + query))
            .timeout(requestTimeout)
            .DELETE()
            .build();
        send(worker, request);
    }

    @Override
    public Optional<Operation> fetchOperation(WorkerRegistration worker, String operationId) {
        HttpRequest request = get(worker, "/operations/" + operationId);
        try {
            return Optional.of(objectMapper.readValue(send(worker, request), Operation.class));
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new WorkerDispatchException(worker.workerId(), "unreadable operation payload", e);
        }
    }

    @Override
    public MetricsPage fetchMetrics(WorkerRegistration worker, String operationId, int cursor) {
        HttpRequest request = get(worker, "/operations/" + operationId + "/metrics?cursor=" + cursor);
        try {
            JsonNode body = objectMapper.readTree(send(worker, request));
            List<Map<String, Object>> metrics = objectMapper.convertValue(body.path("metrics"), METRICS_TYPE);
            return new MetricsPage(metrics != null ? metrics : List.of(), body.path("cursor").asInt(cursor));
        } catch (IOException e) {
            throw new WorkerDispatchException(worker.workerId(), "unreadable metrics payload", e);
        }
    }

    // ========== Helper Methods ==========

    private HttpRequest post(WorkerRegistration worker, String path, JsonNode body) {
        try {
            return HttpRequest.newBuilder()
                .uri(URI.create(worker.endpointUrl() + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        } catch (IOException e) {
            throw new WorkerDispatchException(worker.workerId(), "unserializable request", e);
        }
    }

    private HttpRequest get(WorkerRegistration worker, String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(worker.endpointUrl() + path))
            .timeout(requestTimeout)
            .GET()
            .build();
    }

    private String send(WorkerRegistration worker, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WorkerDispatchException(worker.workerId(), "unreachable at " + worker.endpointUrl(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerDispatchException(worker.workerId(), "interrupted", e);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new NotFoundException("Worker resource", request.uri().getPath());
        }
        if (status == 409) {
            throw new OperationConflictException(response.body());
        }
        if (status < 200 || status >= 300) {
            throw new WorkerDispatchException(worker.workerId(),
                String.format("%s %s returned %d: %s", request.method(), request.uri().getPath(),
                    status, response.body()));
        }
        return response.body();
    }
}
