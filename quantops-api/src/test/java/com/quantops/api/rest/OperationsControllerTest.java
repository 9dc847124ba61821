package com.quantops.api.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import com.quantops.core.model.WorkerStatus;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.coordinator.OperationRegistry;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.persistence.InMemoryCheckpointRepository;
import com.quantops.engine.persistence.InMemoryOperationRepository;
import com.quantops.engine.registry.WorkerRegistry;
import com.quantops.worker.CheckpointWriter;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.LocalWorkerGateway;
import com.quantops.worker.OperationFunction;
import com.quantops.worker.WorkerRuntime;
import com.quantops.worker.web.ApiExceptionHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class OperationsControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path artifactsRoot;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final Clock clock = Clock.systemUTC();
    private final CountDownLatch release = new CountDownLatch(1);
    private CheckpointService checkpoints;
    private OperationRegistry operations;
    private WorkerRegistry workers;
    private CheckpointWriter writer;
    private WorkerRuntime runtime;
    private OperationOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        OperationMetrics metrics = OperationMetrics.noop();
        checkpoints = new CheckpointService(new InMemoryCheckpointRepository(), objectMapper, artifactsRoot, metrics, clock);
        operations = new OperationRegistry(new InMemoryOperationRepository(), checkpoints, metrics, clock);
        workers = new WorkerRegistry(clock, Duration.ofSeconds(90), Duration.ofMinutes(5));
        writer = new CheckpointWriter(checkpoints, Duration.ofSeconds(5));
        runtime = new WorkerRuntime(
            OperationType.TRAINING, new GatedFunction(release), operations, writer,
            () -> new CheckpointPolicy(1, Duration.ofHours(1), clock),
            WorkerRuntime.newExecutor(OperationType.TRAINING, 2),
            metrics, objectMapper, clock);
        LocalWorkerGateway gateway = new LocalWorkerGateway(List.of(runtime));
        gateway.registerWith(workers, 2, WorkerCapabilities.cpuOnly());
        orchestrator = new OperationOrchestrator(operations, workers, gateway, checkpoints, objectMapper);

        mockMvc = MockMvcBuilders
            .standaloneSetup(new OperationsController(operations, orchestrator))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        runtime.shutdown(Duration.ofSeconds(2));
        writer.close();
    }

    private Operation startTraining() {
        return orchestrator.createAndStart(OperationType.TRAINING, objectMapper.createObjectNode().put("symbol", "EURUSD"), null);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!condition.getAsBoolean()) {
            assertThat(System.currentTimeMillis()).as("condition not met in time").isLessThan(deadline);
            Thread.sleep(10);
        }
    }

    // ========== Query Tests ==========

    @Test
    @DisplayName("GET /api/v1/operations lists items with total and active counts")
    void testListOperations() throws Exception {
        Operation running = startTraining();
        Operation pending = operations.create(OperationType.BACKTESTING, Map.of(), null);
        operations.cancel(pending.operationId(), "not needed");

        mockMvc.perform(get("/api/v1/operations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items.length()").value(2))
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.active_count").value(1));

        mockMvc.perform(get("/api/v1/operations").param("status", "cancelled"))
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].operationId").value(pending.operationId()));

        mockMvc.perform(get("/api/v1/operations").param("type", "training"))
            .andExpect(jsonPath("$.items[0].operationId").value(running.operationId()));
    }

    @Test
    @DisplayName("An unknown status filter is rejected")
    void testListInvalidStatus() throws Exception {
        mockMvc.perform(get("/api/v1/operations").param("status", "sleeping"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("GET /api/v1/operations/{id} returns the operation or 404")
    void testGetOperation() throws Exception {
        Operation op = startTraining();

        mockMvc.perform(get("/api/v1/operations/" + op.operationId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.operationId").value(op.operationId()))
            .andExpect(jsonPath("$.operationType").value("TRAINING"));

        mockMvc.perform(get("/api/v1/operations/op_training_missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Children and metrics are served for a known operation")
    void testChildrenAndMetrics() throws Exception {
        Operation parent = operations.create(OperationType.AGENT_RESEARCH, Map.of(), null);
        Operation child = orchestrator.createAndStart(OperationType.TRAINING, objectMapper.createObjectNode(), parent.operationId());
        awaitCondition(() -> orchestrator.metrics(child.operationId(), 0).cursor() >= 1);

        mockMvc.perform(get("/api/v1/operations/" + parent.operationId() + "/children"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].operationId").value(child.operationId()));

        mockMvc.perform(get("/api/v1/operations/" + child.operationId() + "/metrics").param("cursor", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics[0].unit").value(0))
            .andExpect(jsonPath("$.cursor").value(1));

        mockMvc.perform(get("/api/v1/operations/op_training_missing/metrics"))
            .andExpect(status().isNotFound());
    }

    // ========== Cancel & Resume Tests ==========

    @Test
    @DisplayName("DELETE cancels once; a second cancel is a conflict")
    void testCancel() throws Exception {
        Operation op = startTraining();

        mockMvc.perform(delete("/api/v1/operations/" + op.operationId()).param("reason", "Stopped by user"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(delete("/api/v1/operations/" + op.operationId()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("OPERATION_CONFLICT"));
    }

    @Test
    @DisplayName("A cancelled run resumes from its checkpoint and completes")
    void testResume() throws Exception {
        Operation op = startTraining();
        awaitCondition(() -> checkpoints.exists(op.operationId()));
        orchestrator.cancel(op.operationId(), "pause");
        assertThat(runtime.awaitCompletion(op.operationId(), WAIT)).isTrue();
        awaitCondition(() -> workers.list().stream().allMatch(w -> w.status() == WorkerStatus.IDLE));

        mockMvc.perform(post("/api/v1/operations/" + op.operationId() + "/resume"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.operation_id").value(op.operationId()));

        release.countDown();
        awaitCondition(() -> operations.get(op.operationId()).status() == OperationStatus.COMPLETED);
        assertThat(operations.get(op.operationId()).resultSummary().get("units").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Resume without a checkpoint is 404")
    void testResumeWithoutCheckpoint() throws Exception {
        Operation op = operations.create(OperationType.TRAINING, Map.of(), null);
        operations.cancel(op.operationId(), "never started");

        mockMvc.perform(post("/api/v1/operations/" + op.operationId() + "/resume"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("Resume of an operation that is still running is 409")
    void testResumeRunningConflict() throws Exception {
        Operation op = startTraining();
        awaitCondition(() -> checkpoints.exists(op.operationId()));

        mockMvc.perform(post("/api/v1/operations/" + op.operationId() + "/resume"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("OPERATION_CONFLICT"));
    }

    /**
     * Three units; the second and later wait for the release latch.
     */
    private static final class GatedFunction implements OperationFunction {

        private final CountDownLatch release;

        GatedFunction(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public com.fasterxml.jackson.databind.JsonNode execute(ExecutionContext ctx) {
            for (int unit = ctx.startUnit(); unit < 3; unit++) {
                ctx.throwIfCancelled();
                ctx.progress().writeState(100.0 * (unit + 1) / 3, "Unit " + unit);
                ctx.progress().appendMetric(Map.of("unit", unit));
                int completed = unit + 1;
                ctx.checkpointIfDue(completed, () -> ctx.toJsonNode(Map.of("units", completed)));
                awaitRelease(ctx);
            }
            return ctx.toJsonNode(Map.of("units", 3));
        }

        private void awaitRelease(ExecutionContext ctx) {
            try {
                while (!release.await(10, TimeUnit.MILLISECONDS)) {
                    if (ctx.isCancelled()) {
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
