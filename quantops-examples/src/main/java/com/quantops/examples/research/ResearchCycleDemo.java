package com.quantops.examples.research;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.agent.AgentResearchWorker;
import com.quantops.agent.AgentService;
import com.quantops.agent.GateThresholds;
import com.quantops.agent.QualityGates;
import com.quantops.agent.ResearchPhase;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.model.Checkpoint;
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
import com.quantops.examples.simulated.SimulatedFunctions;
import com.quantops.worker.CheckpointWriter;
import com.quantops.worker.LocalWorkerGateway;
import com.quantops.worker.OperationFunction;
import com.quantops.worker.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Demonstration runner for research cycles on in-process simulated workers.
 *
 * Shows:
 * 1. A full cycle: design, training, backtest, assessment
 * 2. Cancelling a cycle mid-training and resuming it from its checkpoints
 * 3. A cycle stopped by the backtest quality gate
 */
public class ResearchCycleDemo {

    private static final Logger log = LoggerFactory.getLogger(ResearchCycleDemo.class);
    private static final Duration TIMEOUT = Duration.ofMinutes(2);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.systemUTC();
    private final OperationRegistry operations;
    private final WorkerRegistry workers;
    private final CheckpointService checkpoints;
    private final CheckpointWriter writer;
    private final OperationOrchestrator orchestrator;
    private final AgentService agent;
    private final List<WorkerRuntime> runtimes = new ArrayList<>();

    public ResearchCycleDemo(Path artifactsRoot) {
        OperationMetrics metrics = OperationMetrics.noop();
        checkpoints = new CheckpointService(new InMemoryCheckpointRepository(), mapper, artifactsRoot, metrics, clock);
        operations = new OperationRegistry(new InMemoryOperationRepository(), checkpoints, metrics, clock);
        workers = new WorkerRegistry(clock, Duration.ofSeconds(90), Duration.ofMinutes(5));
        writer = new CheckpointWriter(checkpoints, Duration.ofSeconds(10));

        for (OperationType type : List.of(OperationType.AGENT_DESIGN, OperationType.TRAINING,
                OperationType.BACKTESTING, OperationType.AGENT_ASSESSMENT)) {
            runtimes.add(runtime(type, SimulatedFunctions.forType(type), metrics));
        }
        LocalWorkerGateway gateway = new LocalWorkerGateway(runtimes);
        orchestrator = new OperationOrchestrator(operations, workers, gateway, checkpoints, mapper);

        AgentResearchWorker research = new AgentResearchWorker(operations, orchestrator,
            new QualityGates(GateThresholds.defaults(), metrics), Duration.ofMillis(100), mapper);
        WorkerRuntime researchRuntime = runtime(OperationType.AGENT_RESEARCH, research, metrics);
        runtimes.add(researchRuntime);
        gateway.host(researchRuntime);
        gateway.registerWith(workers, 1, WorkerCapabilities.cpuOnly());

        agent = new AgentService(operations, orchestrator, 1);
    }

    private WorkerRuntime runtime(OperationType type, OperationFunction function, OperationMetrics metrics) {
        return new WorkerRuntime(type, function, operations, writer,
            () -> new CheckpointPolicy(2, Duration.ofMinutes(1), clock),
            WorkerRuntime.newExecutor(type, 1), metrics, mapper, clock);
    }

    public static void main(String[] args) throws Exception {
        ResearchCycleDemo demo = new ResearchCycleDemo(Files.createTempDirectory("quantops-demo"));

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║        QUANTOPS - RESEARCH CYCLE CHECKPOINT/RESUME DEMONSTRATION     ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        try {
            demo.runScenario1_FullCycle();
            demo.runScenario2_CancelAndResume();
            demo.runScenario3_QualityGate();
        } finally {
            demo.close();
        }

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: every phase runs as a child operation and the cycle completes.
     */
    public Operation runScenario1_FullCycle() throws InterruptedException {
        banner("SCENARIO 1: Full Research Cycle");

        Operation cycle = agent.trigger(trigger("EURUSD"));
        Operation done = awaitStatus(cycle.operationId(), OperationStatus.COMPLETED);
        logChildren(cycle.operationId());

        log.info("✓ SCENARIO 1 COMPLETE: verdict={}, tokens={}",
            done.resultSummary().path("verdict").asText(), done.resultSummary().path("total_tokens").asLong());
        return done;
    }

    /**
     * SCENARIO 2: cancel during training, then resume. Training continues from
     * its cancellation checkpoint instead of epoch zero.
     */
    public Operation runScenario2_CancelAndResume() throws InterruptedException {
        banner("SCENARIO 2: Cancel Mid-Training, Then Resume");

        Operation cycle = agent.trigger(trigger("GBPUSD"));
        String cycleId = cycle.operationId();
        await("training to report epochs", () -> {
            String trainingId = operations.get(cycleId).metadataString(ResearchPhase.TRAINING.childKey());
            return trainingId != null && operations.metrics(trainingId, 0).cursor() >= 3;
        });

        orchestrator.cancel(cycleId, "Paused by operator");
        awaitStatus(cycleId, OperationStatus.CANCELLED);
        String trainingId = operations.get(cycleId).metadataString(ResearchPhase.TRAINING.childKey());
        Checkpoint checkpoint = checkpoints.load(trainingId, false).orElseThrow();
        log.info("Training {} stopped with a {} checkpoint at epoch {}", trainingId,
            checkpoint.checkpointType().wireName(), checkpoint.state().path("unit_index").asInt());

        await("workers to go idle", () -> workers.list().stream().allMatch(w -> w.status() == WorkerStatus.IDLE));
        orchestrator.resume(cycleId);
        Operation done = awaitStatus(cycleId, OperationStatus.COMPLETED);
        logChildren(cycleId);

        log.info("✓ SCENARIO 2 COMPLETE: resumed cycle finished with verdict={}",
            done.resultSummary().path("verdict").asText());
        return done;
    }

    /**
     * SCENARIO 3: a losing strategy is stopped by the backtest gate.
     */
    public Operation runScenario3_QualityGate() throws InterruptedException {
        banner("SCENARIO 3: Backtest Quality Gate");

        await("workers to go idle", () -> workers.list().stream().allMatch(w -> w.status() == WorkerStatus.IDLE));
        ObjectNode losing = trigger("USDJPY").put("drift", -0.002);
        Operation cycle = agent.trigger(losing);
        Operation failed = awaitStatus(cycle.operationId(), OperationStatus.FAILED);

        log.info("✓ SCENARIO 3 COMPLETE: cycle failed as expected: {}", failed.errorMessage());
        return failed;
    }

    public void close() throws InterruptedException {
        for (WorkerRuntime runtime : runtimes) {
            runtime.shutdown(Duration.ofSeconds(10));
        }
        writer.close();
    }

    // ========== Helper Methods ==========

    private ObjectNode trigger(String symbol) {
        return mapper.createObjectNode()
            .put("symbol", symbol)
            .put("epochs", 8)
            .put("epoch_delay_ms", 150)
            .put("bars", 2000)
            .put("bars_per_unit", 250)
            .put("unit_delay_ms", 50);
    }

    private Operation awaitStatus(String operationId, OperationStatus expected) throws InterruptedException {
        await(operationId + " to become " + expected, () -> operations.get(operationId).status().isTerminal());
        Operation operation = operations.get(operationId);
        if (operation.status() != expected) {
            log.warn("Operation {} ended {} instead of {}: {}",
                operationId, operation.status(), expected, operation.errorMessage());
        }
        return operation;
    }

    private void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("Timed out waiting for " + what);
            }
            Thread.sleep(50);
        }
    }

    private void logChildren(String cycleId) {
        for (Operation child : operations.children(cycleId)) {
            log.info("  {} {} -> {}", child.operationType(), child.operationId(), child.status());
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }
}
