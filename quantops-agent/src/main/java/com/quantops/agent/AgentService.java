package com.quantops.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.repository.OperationFilter;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.service.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point for starting and inspecting research cycles.
 */
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private static final List<OperationStatus> ACTIVE_STATUSES =
        List.of(OperationStatus.PENDING, OperationStatus.RUNNING, OperationStatus.RESUMING);
    private static final int LIST_LIMIT = 100;

    private final OperationsService operations;
    private final OperationOrchestrator orchestrator;
    private final int maxConcurrentCycles;

    public AgentService(OperationsService operations, OperationOrchestrator orchestrator, int maxConcurrentCycles) {
        this.operations = operations;
        this.orchestrator = orchestrator;
        this.maxConcurrentCycles = maxConcurrentCycles;
    }

    /**
     * Start a research cycle.
     *
     * @param parameters Trigger parameters passed to every phase
     * @return The AGENT_RESEARCH operation
     * @throws OperationConflictException if the concurrent cycle limit is reached
     */
    public synchronized Operation trigger(JsonNode parameters) {
        List<Operation> active = activeCycles();
        if (active.size() >= maxConcurrentCycles) {
            throw new OperationConflictException(String.format(
                "Research cycle %s is already active (limit %d)", active.get(0).operationId(), maxConcurrentCycles));
        }
        Operation cycle = orchestrator.createAndStart(OperationType.AGENT_RESEARCH, parameters, null);
        log.info("Triggered research cycle {}", cycle.operationId());
        return cycle;
    }

    /**
     * Current state of the agent: its active cycles with their phase.
     */
    public AgentStatus status() {
        List<CycleStatus> cycles = activeCycles().stream()
            .map(cycle -> toCycleStatus(operations.get(cycle.operationId())))
            .toList();
        return new AgentStatus(!cycles.isEmpty(), cycles);
    }

    /**
     * Active research cycles, oldest first.
     */
    public List<Operation> activeCycles() {
        List<Operation> active = new ArrayList<>();
        for (OperationStatus status : ACTIVE_STATUSES) {
            active.addAll(operations.list(
                new OperationFilter(status, OperationType.AGENT_RESEARCH, null, LIST_LIMIT, 0)).items());
        }
        active.sort(Comparator.comparing(Operation::createdAt));
        return active;
    }

    private static CycleStatus toCycleStatus(Operation cycle) {
        String phaseName = cycle.metadataString(AgentResearchWorker.PHASE);
        ResearchPhase phase = ResearchPhase.fromWireName(phaseName);
        String childId = phase.runsChild() ? cycle.metadataString(phase.childKey()) : null;
        return new CycleStatus(
            cycle.operationId(),
            cycle.status(),
            phase.wireName(),
            cycle.progress().percentage(),
            cycle.metadataString(AgentResearchWorker.STRATEGY_NAME),
            childId
        );
    }

    public record AgentStatus(boolean active, List<CycleStatus> cycles) {}

    public record CycleStatus(
        String operationId,
        OperationStatus status,
        String phase,
        double progressPercentage,
        String strategyName,
        String childOperationId
    ) {}
}
