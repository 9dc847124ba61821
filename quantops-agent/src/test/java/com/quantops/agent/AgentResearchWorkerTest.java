package com.quantops.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
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
import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.LocalWorkerGateway;
import com.quantops.worker.OperationFunction;
import com.quantops.worker.WorkerRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

class AgentResearchWorkerTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    @TempDir
    Path artifactsRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();
    private CheckpointService checkpoints;
    private OperationRegistry operations;
    private WorkerRegistry workers;
    private CheckpointWriter writer;
    private OperationOrchestrator orchestrator;
    private AgentService agentService;

    private EpochTraining training;
    private FixedResult backtest;
    private final List<WorkerRuntime> runtimes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        OperationMetrics metrics = OperationMetrics.noop();
        checkpoints = new CheckpointService(new InMemoryCheckpointRepository(), objectMapper, artifactsRoot, metrics, clock);
        operations = new OperationRegistry(new InMemoryOperationRepository(), checkpoints, metrics, clock);
        workers = new WorkerRegistry(clock, Duration.ofSeconds(90), Duration.ofMinutes(5));
        writer = new CheckpointWriter(checkpoints, Duration.ofSeconds(5));

        training = new EpochTraining(6);
        backtest = new FixedResult(Map.of("win_rate", 0.55, "max_drawdown", 0.18, "sharpe_ratio", 1.2));
        OperationFunction design = new FixedResult(Map.of(
            "strategy_name", "momentum_v1",
            "strategy_path", "strategies/momentum_v1.yaml",
            "tokens_used", 1200,
            "cost_usd", 0.02));
        OperationFunction assessment = new FixedResult(Map.of(
            "verdict", "promising",
            "tokens_used", 800,
            "cost_usd", 0.01));

        runtimes.add(runtime(OperationType.AGENT_DESIGN, design));
        runtimes.add(runtime(OperationType.TRAINING, training));
        runtimes.add(runtime(OperationType.BACKTESTING, backtest));
        runtimes.add(runtime(OperationType.AGENT_ASSESSMENT, assessment));

        LocalWorkerGateway gateway = new LocalWorkerGateway(runtimes);
        orchestrator = new OperationOrchestrator(operations, workers, gateway, checkpoints, objectMapper);
        AgentResearchWorker research = new AgentResearchWorker(
            operations, orchestrator, new QualityGates(GateThresholds.defaults(), metrics),
            Duration.ofMillis(10), objectMapper);
        WorkerRuntime researchRuntime = runtime(OperationType.AGENT_RESEARCH, research);
        runtimes.add(researchRuntime);
        gateway.host(researchRuntime);
        gateway.registerWith(workers, 1, WorkerCapabilities.cpuOnly());
        agentService = new AgentService(operations, orchestrator, 1);
    }

    private WorkerRuntime runtime(OperationType type, OperationFunction function) {
        return new WorkerRuntime(
            type, function, operations, writer,
            () -> new CheckpointPolicy(1, Duration.ofHours(1), clock),
            WorkerRuntime.newExecutor(type, 1),
            OperationMetrics.noop(), objectMapper, clock);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (WorkerRuntime runtime : runtimes) {
            runtime.shutdown(Duration.ofSeconds(2));
        }
        writer.close();
    }

    // ========== Full Cycle ==========

    @Test
    @DisplayName("A cycle runs every phase as a child and completes with the assessment verdict")
    void testCycleCompletes() throws InterruptedException {
        Operation cycle = agentService.trigger(objectMapper.createObjectNode().put("symbol", "EURUSD"));

        Operation done = awaitTerminal(cycle.operationId());

        assertThat(done.status()).isEqualTo(OperationStatus.COMPLETED);
        assertThat(done.resultSummary().get("verdict").asText()).isEqualTo("promising");
        assertThat(done.resultSummary().get("strategy_name").asText()).isEqualTo("momentum_v1");
        assertThat(done.resultSummary().get("total_tokens").asLong()).isEqualTo(2000);
        assertThat(done.metadataString(AgentResearchWorker.PHASE)).isEqualTo("done");

        List<Operation> children = operations.children(cycle.operationId());
        assertThat(children).extracting(Operation::operationType).containsExactly(
            OperationType.AGENT_DESIGN, OperationType.TRAINING,
            OperationType.BACKTESTING, OperationType.AGENT_ASSESSMENT);
        assertThat(children).allMatch(c -> c.status() == OperationStatus.COMPLETED);
        assertThat(checkpoints.exists(cycle.operationId())).isFalse();
    }

    @Test
    @DisplayName("Phase requests carry the trigger parameters and earlier results")
    void testPhaseRequests() throws InterruptedException {
        Operation cycle = agentService.trigger(objectMapper.createObjectNode().put("symbol", "EURUSD"));
        awaitTerminal(cycle.operationId());

        assertThat(training.lastRequest.get("symbol").asText()).isEqualTo("EURUSD");
        assertThat(training.lastRequest.get("strategy_path").asText()).isEqualTo("strategies/momentum_v1.yaml");
        assertThat(backtest.lastRequest.get("model_path").asText()).isEqualTo("models/momentum_v1/model.pt");
    }

    // ========== Gates and Failures ==========

    @Test
    @DisplayName("A failed training gate fails the cycle while the training child stays completed")
    void testTrainingGateFails() throws InterruptedException {
        training.accuracy = 0.05;
        Operation cycle = agentService.trigger(objectMapper.createObjectNode());

        Operation failed = awaitTerminal(cycle.operationId());

        assertThat(failed.status()).isEqualTo(OperationStatus.FAILED);
        assertThat(failed.errorMessage())
            .isEqualTo("Training gate failed: accuracy_below_threshold (5.0% < 10.0%)");
        List<Operation> children = operations.children(cycle.operationId());
        assertThat(children).extracting(Operation::operationType)
            .containsExactly(OperationType.AGENT_DESIGN, OperationType.TRAINING);
        assertThat(children.get(1).status()).isEqualTo(OperationStatus.COMPLETED);
    }

    @Test
    @DisplayName("A failed backtest gate stops the cycle before assessment")
    void testBacktestGateFails() throws InterruptedException {
        backtest.result = Map.of("win_rate", 0.55, "max_drawdown", 0.6, "sharpe_ratio", 1.2);
        Operation cycle = agentService.trigger(objectMapper.createObjectNode());

        Operation failed = awaitTerminal(cycle.operationId());

        assertThat(failed.errorMessage()).isEqualTo("Backtest gate failed: drawdown_too_high (60.0% > 40.0%)");
        assertThat(operations.children(cycle.operationId())).hasSize(3);
    }

    @Test
    @DisplayName("A failed child fails the cycle naming the phase")
    void testChildFailure() throws InterruptedException {
        training.failAt = 2;
        Operation cycle = agentService.trigger(objectMapper.createObjectNode());

        Operation failed = awaitTerminal(cycle.operationId());

        assertThat(failed.status()).isEqualTo(OperationStatus.FAILED);
        assertThat(failed.errorMessage())
            .startsWith("Phase training failed")
            .endsWith("Insufficient bars: 10 < 50");
    }

    // ========== Cancellation and Resume ==========

    @Test
    @DisplayName("Cancel during training checkpoints the cycle; resume continues the training child from its epoch")
    void testCancelAndResumeDuringTraining() throws InterruptedException {
        training.pauseAt = 3;
        Operation cycle = agentService.trigger(objectMapper.createObjectNode().put("symbol", "EURUSD"));
        String cycleId = cycle.operationId();
        assertThat(training.reached.await(10, TimeUnit.SECONDS)).isTrue();
        String trainingId = childOf(cycleId, OperationType.TRAINING).operationId();

        orchestrator.cancel(cycleId, "Stopped by operator");
        assertThat(runtime(OperationType.AGENT_RESEARCH).awaitCompletion(cycleId, WAIT)).isTrue();
        assertThat(runtime(OperationType.TRAINING).awaitCompletion(trainingId, WAIT)).isTrue();

        Checkpoint parentCheckpoint = checkpoints.load(cycleId, false).orElseThrow();
        assertThat(parentCheckpoint.checkpointType()).isEqualTo(CheckpointType.CANCELLATION);
        assertThat(parentCheckpoint.state().path("state").path("phase").asText()).isEqualTo("training");
        assertThat(parentCheckpoint.state().path("state").path("training_op_id").asText()).isEqualTo(trainingId);

        Operation cancelledChild = operations.get(trainingId);
        assertThat(cancelledChild.status()).isEqualTo(OperationStatus.CANCELLED);
        assertThat(cancelledChild.metadataString(OperationRegistry.CANCELLATION_REASON)).isEqualTo("Parent cancelled");
        assertThat(checkpoints.load(trainingId, false).orElseThrow().state().path("unit_index").asInt()).isEqualTo(3);

        awaitCondition(() -> workers.list().stream().allMatch(w -> w.status() == WorkerStatus.IDLE));
        training.pauseAt = -1;
        training.executed.clear();

        orchestrator.resume(cycleId);
        Operation done = awaitTerminal(cycleId);

        assertThat(done.status()).isEqualTo(OperationStatus.COMPLETED);
        assertThat(training.executed).containsExactly(3, 4, 5);
        assertThat(operations.get(trainingId).status()).isEqualTo(OperationStatus.COMPLETED);
        assertThat(operations.children(cycleId)).filteredOn(c -> c.operationType() == OperationType.TRAINING)
            .hasSize(1);
    }

    @Test
    @DisplayName("A child cancelled on its own cancels the cycle")
    void testChildCancelledStopsCycle() throws InterruptedException {
        training.pauseAt = 1;
        Operation cycle = agentService.trigger(objectMapper.createObjectNode());
        assertThat(training.reached.await(10, TimeUnit.SECONDS)).isTrue();
        String trainingId = childOf(cycle.operationId(), OperationType.TRAINING).operationId();

        orchestrator.cancel(trainingId, "Stopped by operator");
        Operation cancelled = awaitTerminal(cycle.operationId());

        assertThat(cancelled.status()).isEqualTo(OperationStatus.CANCELLED);
        assertThat(cancelled.metadataString(OperationRegistry.CANCELLATION_REASON))
            .isEqualTo("Child operation " + trainingId + " was cancelled");
        assertThat(checkpoints.exists(cycle.operationId())).isTrue();
    }

    // ========== Agent Service ==========

    @Test
    @DisplayName("Only one cycle runs at a time and status reports its phase")
    void testTriggerLimitAndStatus() throws InterruptedException {
        training.pauseAt = 1;
        Operation cycle = agentService.trigger(objectMapper.createObjectNode());
        assertThat(training.reached.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> agentService.trigger(objectMapper.createObjectNode()))
            .isInstanceOf(OperationConflictException.class)
            .hasMessageContaining(cycle.operationId());

        awaitCondition(() -> "training".equals(agentService.status().cycles().get(0).phase()));
        AgentService.AgentStatus status = agentService.status();
        assertThat(status.active()).isTrue();
        assertThat(status.cycles().get(0).operationId()).isEqualTo(cycle.operationId());
        assertThat(status.cycles().get(0).childOperationId())
            .isEqualTo(childOf(cycle.operationId(), OperationType.TRAINING).operationId());

        orchestrator.cancel(cycle.operationId(), "done");
        awaitTerminal(cycle.operationId());
        assertThat(agentService.status().active()).isFalse();
    }

    // ========== Helper Methods ==========

    private WorkerRuntime runtime(OperationType type) {
        return runtimes.stream().filter(r -> r.operationType() == type).findFirst().orElseThrow();
    }

    private Operation childOf(String parentId, OperationType type) throws InterruptedException {
        awaitCondition(() -> operations.children(parentId).stream().anyMatch(c -> c.operationType() == type));
        return operations.children(parentId).stream()
            .filter(c -> c.operationType() == type)
            .findFirst()
            .orElseThrow();
    }

    private Operation awaitTerminal(String operationId) throws InterruptedException {
        awaitCondition(() -> operations.get(operationId).status().isTerminal()
            && !runtime(OperationType.AGENT_RESEARCH).isRunning(operationId));
        return operations.get(operationId);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }

    /**
     * Returns a fixed result and records the request it was given.
     */
    private static class FixedResult implements OperationFunction {

        volatile Map<String, Object> result;
        volatile JsonNode lastRequest;

        FixedResult(Map<String, Object> result) {
            this.result = result;
        }

        @Override
        public JsonNode execute(ExecutionContext ctx) {
            lastRequest = ctx.getRequest();
            ctx.progress().writeState(100.0, "Done");
            return ctx.toJsonNode(result);
        }
    }

    /**
     * Epoch loop that checkpoints every epoch, can pause at an epoch until
     * cancelled and can fail at an epoch.
     */
    private static class EpochTraining implements OperationFunction {

        final int epochs;
        final List<Integer> executed = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch reached = new CountDownLatch(1);
        volatile int pauseAt = -1;
        volatile int failAt = -1;
        volatile double accuracy = 0.62;
        volatile JsonNode lastRequest;

        EpochTraining(int epochs) {
            this.epochs = epochs;
        }

        @Override
        public JsonNode execute(ExecutionContext ctx) throws DomainException {
            lastRequest = ctx.getRequest();
            for (int epoch = ctx.startUnit(); epoch < epochs; epoch++) {
                if (epoch == pauseAt) {
                    reached.countDown();
                    awaitCancellation(ctx);
                }
                if (ctx.isCancelled()) {
                    ctx.saveCancellationCheckpoint(epoch, ctx.toJsonNode(Map.of("epoch", epoch)));
                    ctx.throwIfCancelled();
                }
                if (epoch == failAt) {
                    throw new DomainException(ErrorKind.TRAINING_DATA, "Insufficient bars: 10 < 50");
                }
                executed.add(epoch);
                ctx.progress().writeState(100.0 * (epoch + 1) / epochs, "Epoch " + (epoch + 1) + "/" + epochs);
                int completed = epoch + 1;
                ctx.checkpointIfDue(completed, () -> ctx.toJsonNode(Map.of("epoch", completed)));
            }

            ObjectNode result = ctx.toJsonNode(Map.of(
                "accuracy", accuracy,
                "initial_loss", 0.9,
                "final_loss", 0.35)).deepCopy();
            result.put("model_path", "models/" + ctx.getRequest().path("strategy_name").asText() + "/model.pt");
            return result;
        }

        private static void awaitCancellation(ExecutionContext ctx) {
            long deadline = System.currentTimeMillis() + 10_000;
            while (!ctx.isCancelled() && System.currentTimeMillis() < deadline) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
