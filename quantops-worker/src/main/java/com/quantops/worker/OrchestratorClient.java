package com.quantops.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registers a standalone worker with the orchestrator and keeps it alive
 * with heartbeats. A heartbeat answered with 404 means the orchestrator
 * forgot the worker (e.g. after a restart), so the worker registers again.
 *
 * Usage:
 * <pre>
 * OrchestratorClient client = new OrchestratorClient(
 *     "http://orchestrator:8080", "training-1", OperationType.TRAINING,
 *     "http://training-1:5003", new CapabilityDetector().detect(), objectMapper);
 * client.start(Duration.ofSeconds(30));
 * </pre>
 */
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final String orchestratorUrl;
    private final String workerId;
    private final OperationType workerType;
    private final String endpointUrl;
    private final WorkerCapabilities capabilities;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final ScheduledExecutorService heartbeatScheduler;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public OrchestratorClient(
            String orchestratorUrl,
            String workerId,
            OperationType workerType,
            String endpointUrl,
            WorkerCapabilities capabilities,
            ObjectMapper objectMapper) {
        this.orchestratorUrl = orchestratorUrl;
        this.workerId = workerId;
        this.workerType = workerType;
        this.endpointUrl = endpointUrl;
        this.capabilities = capabilities;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "orchestrator-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Register and start sending heartbeats. Registration failures are retried
     * on the heartbeat schedule.
     */
    public void start(Duration heartbeatInterval) {
        if (running.compareAndSet(false, true)) {
            register();
            heartbeatScheduler.scheduleAtFixedRate(
                this::heartbeat,
                heartbeatInterval.toMillis(),
                heartbeatInterval.toMillis(),
                TimeUnit.MILLISECONDS
            );
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            heartbeatScheduler.shutdownNow();
            log.info("Stopped heartbeats for worker {}", workerId);
        }
    }

    /**
     * Register with the orchestrator.
     *
     * @return true if the orchestrator accepted the registration
     */
    public boolean register() {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("worker_id", workerId);
        body.put("worker_type", workerType.kind());
        body.put("endpoint_url", endpointUrl);
        ObjectNode caps = body.putObject("capabilities");
        caps.put("gpu", capabilities.gpu());
        caps.put("gpu_type", capabilities.gpuType());
        caps.put("gpu_count", capabilities.gpuCount());

        try {
            HttpResponse<String> response = post("/api/v1/workers/register", objectMapper.writeValueAsString(body));
            if (response.statusCode() == 200) {
                log.info("Registered {} worker {} at {} with {}", workerType, workerId, orchestratorUrl, endpointUrl);
                return true;
            }
            log.warn("Registration of worker {} rejected with status {}: {}",
                workerId, response.statusCode(), response.body());
            return false;

        } catch (IOException e) {
            log.warn("Registration of worker {} failed: {}", workerId, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Send one heartbeat, re-registering if the orchestrator no longer knows this worker.
     */
    void heartbeat() {
        try {
            HttpResponse<String> response = post("/api/v1/workers/" + workerId + "/heartbeat", "{}");
            if (response.statusCode() == 404) {
                log.info("Orchestrator does not know worker {}, registering again", workerId);
                register();
            } else if (response.statusCode() != 200) {
                log.warn("Heartbeat of worker {} returned {}", workerId, response.statusCode());
            }
        } catch (IOException e) {
            log.warn("Heartbeat of worker {} failed: {}", workerId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(orchestratorUrl + path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
