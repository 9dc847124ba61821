package com.quantops.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.cancellation.CancellationToken;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.exception.InvalidStateTransitionException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationCancelledException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.QuantOpsException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.progress.CheckpointingProgressBridge;
import com.quantops.core.progress.MetricsPage;
import com.quantops.engine.logging.LoggingContext;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.service.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Hosts one kind of operation function: starts and resumes runs on a
 * background executor and maps their outcome onto the operation lifecycle.
 *
 * Outcomes:
 * - Function returns: COMPLETED with the returned summary
 * - DomainException: FAILED with the message verbatim, plus a failure checkpoint
 * - Cancellation observed: CANCELLED, keeping the function's cancellation checkpoint
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    public static final String PARAMETERS = "parameters";

    private final OperationType operationType;
    private final OperationFunction function;
    private final OperationsService operations;
    private final CheckpointWriter checkpointWriter;
    private final Supplier<CheckpointPolicy> policyFactory;
    private final ExecutorService executor;
    private final OperationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Execution> active = new ConcurrentHashMap<>();
    private final List<Consumer<String>> completionListeners = new CopyOnWriteArrayList<>();

    public WorkerRuntime(
            OperationType operationType,
            OperationFunction function,
            OperationsService operations,
            CheckpointWriter checkpointWriter,
            Supplier<CheckpointPolicy> policyFactory,
            ExecutorService executor,
            OperationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.operationType = operationType;
        this.function = function;
        this.operations = operations;
        this.checkpointWriter = checkpointWriter;
        this.policyFactory = policyFactory;
        this.executor = executor;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Fixed-size executor with named daemon threads for one runtime.
     */
    public static ExecutorService newExecutor(OperationType type, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, type.kind() + "-runtime-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Lifecycle Operations ==========

    /**
     * Start a run. Uses the PENDING operation with the given id when the
     * orchestrator created one in this process; otherwise records a new operation.
     *
     * @param request The function's request
     * @param operationId Caller-assigned id, or null to generate one
     * @param parentOperationId Parent operation, or null
     * @return The operation, RUNNING once this returns
     * @throws OperationConflictException if the id belongs to an operation that is not PENDING
     */
    public Operation start(JsonNode request, String operationId, String parentOperationId) {
        JsonNode effectiveRequest = request != null ? request : objectMapper.createObjectNode();
        Operation operation = operationId != null
            ? operations.find(operationId).orElse(null)
            : null;

        if (operation == null) {
            Map<String, Object> metadata = Map.of(PARAMETERS, objectMapper.convertValue(effectiveRequest, Map.class));
            operation = operationId != null
                ? operations.create(operationId, operationType, metadata, parentOperationId)
                : operations.create(operationType, metadata, parentOperationId);
        } else if (operation.status() != OperationStatus.PENDING) {
            throw new OperationConflictException(operationId, operation.status(), "start");
        }

        launch(operation, effectiveRequest, null);
        return operations.get(operation.operationId());
    }

    public Operation start(JsonNode request) {
        return start(request, null, null);
    }

    /**
     * Resume a CANCELLED or FAILED run from its checkpoint. An operation the
     * orchestrator already moved to RESUMING is taken as is; an operation this
     * process has never seen is adopted from the checkpoint.
     *
     * @throws NotFoundException if the operation has no checkpoint
     * @throws OperationConflictException if the operation is not resumable or another caller won
     */
    public Operation resume(String operationId) {
        Checkpoint checkpoint = checkpointWriter.checkpointService().load(operationId, true)
            .orElseThrow(() -> new NotFoundException("Checkpoint", operationId));
        ResumeContext resumeContext = ResumeContext.fromCheckpoint(checkpoint);

        Operation operation = operations.find(operationId).orElse(null);
        if (operation == null) {
            operation = operations.adopt(operationId, operationType,
                Map.of(PARAMETERS, objectMapper.convertValue(resumeContext.originalRequest(), Map.class)));
        } else if (operation.status().isResumable()) {
            if (!operations.tryResume(operationId)) {
                throw new OperationConflictException(operationId, operations.get(operationId).status(), "resume");
            }
        } else if (operation.status() != OperationStatus.RESUMING || active.containsKey(operationId)) {
            throw new OperationConflictException(operationId, operation.status(), "resume");
        }

        log.info("Resuming {} operation {} from unit {} ({} checkpoint)",
            operationType, operationId, resumeContext.resumeFromUnit(),
            resumeContext.checkpointType().wireName());
        launch(operations.get(operationId), resumeContext.originalRequest(), resumeContext);
        return operations.get(operationId);
    }

    /**
     * Cancel a run. The function observes the flipped token at its next unit boundary.
     *
     * @throws OperationConflictException if the operation already finished
     */
    public Operation cancel(String operationId, String reason) {
        return operations.cancel(operationId, reason != null ? reason : "Cancelled by request");
    }

    // ========== Queries ==========

    /**
     * Operation with progress refreshed from the run's bridge.
     *
     * @throws NotFoundException if the operation is unknown
     */
    public Operation snapshot(String operationId) {
        return operations.get(operationId);
    }

    public MetricsPage metrics(String operationId, int cursor) {
        return operations.metrics(operationId, cursor);
    }

    public OperationType operationType() {
        return operationType;
    }

    public Set<String> activeOperationIds() {
        return Set.copyOf(active.keySet());
    }

    public boolean isRunning(String operationId) {
        return active.containsKey(operationId);
    }

    /**
     * Register a callback invoked with the operation id after every run ends.
     */
    public void addCompletionListener(Consumer<String> listener) {
        completionListeners.add(listener);
    }

    /**
     * Wait for a run to end.
     *
     * @return true if the run ended (or was not running) within the timeout
     */
    public boolean awaitCompletion(String operationId, Duration timeout) throws InterruptedException {
        Execution execution = active.get(operationId);
        return execution == null || execution.done().await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Ask every active run to stop with a shutdown checkpoint and wait for them.
     *
     * @return Operation ids still running when the timeout elapsed
     */
    public List<String> shutdown(Duration timeout) throws InterruptedException {
        List<Execution> executions = new ArrayList<>(active.values());
        executions.forEach(e -> e.token().cancelForShutdown());

        long deadline = clock.millis() + timeout.toMillis();
        List<String> unfinished = new ArrayList<>();
        for (Execution execution : executions) {
            long remaining = Math.max(0, deadline - clock.millis());
            if (!execution.done().await(remaining, TimeUnit.MILLISECONDS)) {
                unfinished.add(execution.context().getOperationId());
            }
        }
        executor.shutdown();
        return unfinished;
    }

    // ========== Execution ==========

    private void launch(Operation operation, JsonNode request, ResumeContext resumeContext) {
        String operationId = operation.operationId();
        CancellationToken token = new CancellationToken(operationId);
        CheckpointingProgressBridge bridge = new CheckpointingProgressBridge(clock);
        ExecutionContext context = new ExecutionContext(
            operationId, operationType, request, token, bridge, resumeContext,
            policyFactory.get(), checkpointWriter, function.artifactManifest(), objectMapper);

        Execution execution = new Execution(context, token, new CountDownLatch(1));
        if (active.putIfAbsent(operationId, execution) != null) {
            throw new OperationConflictException(operationId, operation.status(), "start");
        }
        operations.registerBridge(operationId, bridge);
        operations.registerCancellationToken(operationId, token);

        try {
            operations.start(operationId);
            executor.submit(() -> run(execution, operation.parentOperationId()));
        } catch (RuntimeException e) {
            active.remove(operationId);
            operations.release(operationId);
            execution.done().countDown();
            failQuietly(operationId, "Failed to launch: " + e.getMessage());
            if (e instanceof RejectedExecutionException) {
                throw new OperationConflictException("Worker is shutting down; cannot run " + operationId);
            }
            throw e;
        }
    }

    private void run(Execution execution, String parentOperationId) {
        ExecutionContext context = execution.context();
        String operationId = context.getOperationId();

        try (var ctx = LoggingContext.forOperation(operationId, operationType.name(), parentOperationId)) {
            log.info("Executing {} operation {} from unit {}", operationType, operationId, context.startUnit());
            try {
                JsonNode result = function.execute(context);
                operations.complete(operationId, result);

            } catch (OperationCancelledException e) {
                handleCancelled(execution);

            } catch (DomainException e) {
                handleDomainFailure(context, e);

            } catch (InvalidStateTransitionException e) {
                log.warn("Operation {} finished after its status changed: {}", operationId, e.getMessage());

            } catch (RuntimeException e) {
                if (operations.get(operationId).status() == OperationStatus.COMPLETED) {
                    log.warn("Operation {} completed but its cleanup failed: {}", operationId, e.getMessage());
                    return;
                }
                log.error("Operation {} failed with unexpected error", operationId, e);
                saveFailureCheckpoint(context);
                failQuietly(operationId, "Unexpected error: " + e.getMessage());

            } finally {
                operations.release(operationId);
                active.remove(operationId);
                execution.done().countDown();
                notifyListeners(operationId);
            }
        }
    }

    private void handleCancelled(Execution execution) {
        String operationId = execution.context().getOperationId();
        CancellationToken token = execution.token();
        Operation current = operations.get(operationId);
        if (current.status().isCancellable()) {
            String reason = token.isShutdown() ? CancellationToken.SHUTDOWN_REASON : token.reason();
            try {
                operations.cancel(operationId, reason);
            } catch (OperationConflictException e) {
                log.warn("Operation {} reached {} before cancellation was recorded",
                    operationId, operations.get(operationId).status());
                return;
            }
        }
        log.info("Operation {} stopped after cancellation: {}", operationId, token.reason());
    }

    private void handleDomainFailure(ExecutionContext context, DomainException e) {
        String operationId = context.getOperationId();
        switch (e.getKind()) {
            case TRAINING_DATA, BACKTEST_DATA, INVALID_REQUEST, QUALITY_GATE, PHASE_FAILED ->
                log.warn("Operation {} rejected its input ({}): {}", operationId, e.getKind(), e.getMessage());
            case MODEL_LOAD, INTERNAL ->
                log.error("Operation {} failed ({}): {}", operationId, e.getKind(), e.getMessage(), e);
        }
        metrics.domainFailure(operationType, e.getKind().name().toLowerCase());

        saveFailureCheckpoint(context);
        failQuietly(operationId, e.getMessage());
    }

    private void saveFailureCheckpoint(ExecutionContext context) {
        if (!context.hasKnownState()) {
            return;
        }
        try {
            context.saveFailureCheckpoint();
        } catch (QuantOpsException e) {
            log.warn("Failure checkpoint of {} not written: {}", context.getOperationId(), e.getMessage());
        }
    }

    private void failQuietly(String operationId, String message) {
        try {
            operations.fail(operationId, message);
        } catch (InvalidStateTransitionException e) {
            log.warn("Operation {} not marked failed: {}", operationId, e.getMessage());
        }
    }

    private void notifyListeners(String operationId) {
        for (Consumer<String> listener : completionListeners) {
            try {
                listener.accept(operationId);
            } catch (RuntimeException e) {
                log.warn("Completion listener failed for {}", operationId, e);
            }
        }
    }

    private record Execution(ExecutionContext context, CancellationToken token, CountDownLatch done) {}
}
