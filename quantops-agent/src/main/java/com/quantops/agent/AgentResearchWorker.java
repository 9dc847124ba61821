package com.quantops.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.OperationCancelledException;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.QuantOpsException;
import com.quantops.core.model.GateResult;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationProgress;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.service.OperationsService;
import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.OperationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a research cycle as the function of an AGENT_RESEARCH operation.
 *
 * Phases run in order: designing, training, backtesting, assessing. Each phase
 * is a child operation dispatched through the orchestrator and polled until it
 * finishes. Quality gates run after training and after backtesting.
 *
 * Cycle state (current phase, child ids, intermediate results) is mirrored into
 * the operation's metadata and checkpointed whenever a phase starts. A resumed
 * cycle restarts its current phase: a cancelled or failed child with its own
 * checkpoint is resumed, anything else is launched afresh.
 */
public class AgentResearchWorker implements OperationFunction {

    private static final Logger log = LoggerFactory.getLogger(AgentResearchWorker.class);

    public static final String PHASE = "phase";
    public static final String STRATEGY_NAME = "strategy_name";
    public static final String STRATEGY_PATH = "strategy_path";
    public static final String MODEL_PATH = "model_path";
    public static final String TRAINING_RESULT = "training_result";
    public static final String BACKTEST_RESULT = "backtest_result";
    public static final String ASSESSMENT_RESULT = "assessment_result";
    public static final String TOTAL_TOKENS = "total_tokens";
    public static final String TOTAL_COST_USD = "total_cost_usd";
    public static final String TRIGGER = "trigger";

    static final String CHILD_CANCELLED_BY_PARENT = "Parent cancelled";
    private static final int PHASE_COUNT = 4;
    private static final TypeReference<Map<String, Object>> ENTRIES = new TypeReference<>() {};

    private final OperationsService operations;
    private final OperationOrchestrator orchestrator;
    private final QualityGates gates;
    private final Duration pollInterval;
    private final ObjectMapper objectMapper;

    public AgentResearchWorker(
            OperationsService operations,
            OperationOrchestrator orchestrator,
            QualityGates gates,
            Duration pollInterval,
            ObjectMapper objectMapper) {
        this.operations = operations;
        this.orchestrator = orchestrator;
        this.gates = gates;
        this.pollInterval = pollInterval;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode execute(ExecutionContext ctx) throws DomainException {
        ObjectNode state = initialState(ctx);
        ResearchPhase phase = ResearchPhase.fromWireName(state.path(PHASE).asText(null));
        boolean resuming = ctx.getResumeContext().isPresent() && phase.runsChild();
        if (phase == ResearchPhase.IDLE) {
            phase = ResearchPhase.DESIGNING;
        }

        log.info("{} research cycle {} at phase {}",
            resuming ? "Resuming" : "Starting", ctx.getOperationId(), phase.wireName());

        while (phase != ResearchPhase.DONE) {
            JsonNode result = runPhase(ctx, state, phase, resuming);
            resuming = false;
            phase = completePhase(ctx, state, phase, result);
        }

        ctx.progress().writeState(100.0, "Research cycle complete", Map.of(
            ProgressBridge.CURRENT_STEP, ResearchPhase.DONE.wireName(),
            ProgressBridge.STEPS_COMPLETED, PHASE_COUNT,
            ProgressBridge.STEPS_TOTAL, PHASE_COUNT));
        log.info("Research cycle {} completed for strategy {}",
            ctx.getOperationId(), state.path(STRATEGY_NAME).asText("unknown"));
        return summary(state);
    }

    // ========== Phases ==========

    private JsonNode runPhase(ExecutionContext ctx, ObjectNode state, ResearchPhase phase, boolean resuming)
            throws DomainException {
        String childId = resuming ? state.path(phase.childKey()).asText(null) : null;
        if (childId != null) {
            Optional<Operation> existing = operations.find(childId);
            if (existing.isPresent()) {
                Operation child = existing.get();
                if (child.status() == OperationStatus.COMPLETED) {
                    log.info("Phase {} child {} already completed", phase.wireName(), childId);
                    return resultOf(child);
                }
                if (child.status().isActive() || resumeChild(phase, childId)) {
                    enterPhase(ctx, state, phase);
                    return awaitChild(ctx, state, phase, childId);
                }
            }
        }

        childId = launchChild(ctx, state, phase);
        enterPhase(ctx, state, phase);
        return awaitChild(ctx, state, phase, childId);
    }

    /**
     * Resume a stopped child from its own checkpoint.
     *
     * @return false if the child has no checkpoint and the phase must start over
     */
    private boolean resumeChild(ResearchPhase phase, String childId) throws DomainException {
        try {
            orchestrator.resume(childId);
            log.info("Resumed phase {} child {} from its checkpoint", phase.wireName(), childId);
            return true;
        } catch (NotFoundException e) {
            log.info("Phase {} child {} has no checkpoint; relaunching the phase", phase.wireName(), childId);
            return false;
        } catch (OperationConflictException e) {
            log.info("Phase {} child {} was resumed elsewhere; following it", phase.wireName(), childId);
            return true;
        } catch (QuantOpsException e) {
            throw new PhaseFailedException(phase, "could not resume " + childId + ": " + e.getMessage(), e);
        }
    }

    private String launchChild(ExecutionContext ctx, ObjectNode state, ResearchPhase phase) throws DomainException {
        JsonNode request = phaseRequest(state, phase);
        try {
            Operation child = orchestrator.createAndStart(phase.childType(), request, ctx.getOperationId());
            state.put(phase.childKey(), child.operationId());
            log.info("Phase {} started as {}", phase.wireName(), child.operationId());
            return child.operationId();
        } catch (QuantOpsException e) {
            throw new PhaseFailedException(phase, "could not start: " + e.getMessage(), e);
        }
    }

    private void enterPhase(ExecutionContext ctx, ObjectNode state, ResearchPhase phase) {
        state.put(PHASE, phase.wireName());
        publish(ctx, state);
        ctx.checkpointNow(phase.completedBefore(), state.deepCopy());
    }

    private JsonNode awaitChild(ExecutionContext ctx, ObjectNode state, ResearchPhase phase, String childId)
            throws DomainException {
        while (true) {
            if (ctx.isCancelled()) {
                throw stopCycle(ctx, state, phase, childId);
            }

            Operation child = orchestrator.refresh(childId);
            switch (child.status()) {
                case COMPLETED -> {
                    return resultOf(child);
                }
                case FAILED -> throw new PhaseFailedException(phase, childId, child.errorMessage());
                case CANCELLED -> {
                    if (!ctx.isCancelled()) {
                        log.info("Phase {} child {} was cancelled; stopping the cycle", phase.wireName(), childId);
                        ctx.getCancellationToken().cancel("Child operation " + childId + " was cancelled");
                    }
                    throw stopCycle(ctx, state, phase, childId);
                }
                default -> reportProgress(ctx, phase);
            }
            sleep();
        }
    }

    private ResearchPhase completePhase(ExecutionContext ctx, ObjectNode state, ResearchPhase phase, JsonNode result)
            throws GateFailedException {
        switch (phase) {
            case DESIGNING -> {
                copyText(result, state, STRATEGY_NAME);
                copyText(result, state, STRATEGY_PATH);
                addUsage(state, result);
            }
            case TRAINING -> {
                state.set(TRAINING_RESULT, result);
                copyText(result, state, MODEL_PATH);
                publish(ctx, state);
                requirePassed(phase, QualityGates.TRAINING_GATE, gates.checkTraining(result));
            }
            case BACKTESTING -> {
                state.set(BACKTEST_RESULT, result);
                publish(ctx, state);
                requirePassed(phase, QualityGates.BACKTEST_GATE, gates.checkBacktest(result));
            }
            case ASSESSING -> {
                state.set(ASSESSMENT_RESULT, result);
                addUsage(state, result);
            }
            default -> throw new IllegalStateException("Phase " + phase + " runs no child");
        }

        ResearchPhase next = phase.next();
        state.put(PHASE, next.wireName());
        publish(ctx, state);
        log.info("Phase {} of {} completed", phase.wireName(), ctx.getOperationId());
        return next;
    }

    /**
     * Stop the cycle after cancellation: cancel the running child, save the
     * cycle's cancellation checkpoint and build the exception that ends the run.
     */
    private OperationCancelledException stopCycle(
            ExecutionContext ctx, ObjectNode state, ResearchPhase phase, String childId) {
        if (!ctx.getCancellationToken().isShutdown()) {
            cancelChild(childId);
        }
        publish(ctx, state);
        try {
            ctx.saveCancellationCheckpoint(phase.completedBefore(), state.deepCopy());
        } catch (QuantOpsException e) {
            log.warn("Cancellation checkpoint of cycle {} not written: {}", ctx.getOperationId(), e.getMessage());
        }
        log.info("Research cycle {} stopped during phase {}", ctx.getOperationId(), phase.wireName());
        return new OperationCancelledException(ctx.getOperationId(), ctx.getCancellationToken().reason());
    }

    private void cancelChild(String childId) {
        try {
            Operation child = operations.get(childId);
            if (child.status().isCancellable()) {
                orchestrator.cancel(childId, CHILD_CANCELLED_BY_PARENT);
                log.info("Cancelled child operation {}", childId);
            }
        } catch (OperationConflictException e) {
            log.debug("Child {} finished before it could be cancelled", childId);
        } catch (QuantOpsException e) {
            log.warn("Failed to cancel child operation {}: {}", childId, e.getMessage());
        }
    }

    // ========== Helper Methods ==========

    private ObjectNode initialState(ExecutionContext ctx) {
        Optional<ResumeContext> resume = ctx.getResumeContext();
        if (resume.isPresent() && resume.get().state().isObject()) {
            return (ObjectNode) resume.get().state().deepCopy();
        }
        ObjectNode state = objectMapper.createObjectNode();
        state.put(PHASE, ResearchPhase.IDLE.wireName());
        state.set(TRIGGER, ctx.getRequest().deepCopy());
        state.put(TOTAL_TOKENS, 0);
        state.put(TOTAL_COST_USD, 0.0);
        return state;
    }

    private JsonNode phaseRequest(ObjectNode state, ResearchPhase phase) {
        ObjectNode request = objectMapper.createObjectNode();
        JsonNode trigger = state.path(TRIGGER);
        if (phase != ResearchPhase.ASSESSING && trigger.isObject()) {
            request.setAll((ObjectNode) trigger.deepCopy());
        }
        switch (phase) {
            case TRAINING -> {
                copyText(state, request, STRATEGY_NAME);
                copyText(state, request, STRATEGY_PATH);
            }
            case BACKTESTING -> {
                copyText(state, request, STRATEGY_NAME);
                copyText(state, request, MODEL_PATH);
            }
            case ASSESSING -> {
                copyText(state, request, STRATEGY_NAME);
                request.set("training", state.path(TRAINING_RESULT).deepCopy());
                request.set("backtest", state.path(BACKTEST_RESULT).deepCopy());
            }
            default -> {
            }
        }
        return request;
    }

    private void reportProgress(ExecutionContext ctx, ResearchPhase phase) {
        OperationProgress aggregate = operations.aggregateChildProgress(ctx.getOperationId());
        ctx.progress().writeState(aggregate.percentage(), aggregate.message(), Map.of(
            ProgressBridge.CURRENT_STEP, phase.wireName(),
            ProgressBridge.STEPS_COMPLETED, phase.completedBefore(),
            ProgressBridge.STEPS_TOTAL, PHASE_COUNT));
    }

    private void publish(ExecutionContext ctx, ObjectNode state) {
        operations.updateMetadata(ctx.getOperationId(), objectMapper.convertValue(state, ENTRIES));
    }

    private void requirePassed(ResearchPhase phase, String gate, GateResult result) throws GateFailedException {
        if (!result.passed()) {
            throw new GateFailedException(phase, gate, result.reason());
        }
    }

    private JsonNode resultOf(Operation child) {
        JsonNode result = child.resultSummary();
        return result != null && result.isObject() ? result : objectMapper.createObjectNode();
    }

    private ObjectNode summary(ObjectNode state) {
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("success", true);
        summary.put(STRATEGY_NAME, state.path(STRATEGY_NAME).asText("unknown"));
        summary.put("verdict", state.path(ASSESSMENT_RESULT).path("verdict").asText("unknown"));
        summary.set(TRAINING_RESULT, state.path(TRAINING_RESULT).deepCopy());
        summary.set(BACKTEST_RESULT, state.path(BACKTEST_RESULT).deepCopy());
        summary.put(TOTAL_TOKENS, state.path(TOTAL_TOKENS).asLong());
        summary.put(TOTAL_COST_USD, state.path(TOTAL_COST_USD).asDouble());
        return summary;
    }

    private static void addUsage(ObjectNode state, JsonNode result) {
        state.put(TOTAL_TOKENS, state.path(TOTAL_TOKENS).asLong() + result.path("tokens_used").asLong());
        state.put(TOTAL_COST_USD, state.path(TOTAL_COST_USD).asDouble() + result.path("cost_usd").asDouble());
    }

    private static void copyText(JsonNode from, ObjectNode to, String key) {
        JsonNode value = from.get(key);
        if (value != null && value.isTextual()) {
            to.put(key, value.asText());
        }
    }

    private void sleep() throws DomainException {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException(ErrorKind.INTERNAL, "Research cycle interrupted", e);
        }
    }
}
