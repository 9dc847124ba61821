package com.quantops.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.exception.WorkerDispatchException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.progress.MetricsPage;

import java.util.List;
import java.util.Optional;

/**
 * Delegates to the first gateway that supports a worker's endpoint.
 */
public class RoutingWorkerGateway implements WorkerGateway {

    private final List<WorkerGateway> delegates;

    public RoutingWorkerGateway(List<WorkerGateway> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(WorkerRegistration worker) {
        return delegates.stream().anyMatch(g -> g.supports(worker));
    }

    @Override
    public void start(WorkerRegistration worker, Operation operation, JsonNode request) {
        route(worker).start(worker, operation, request);
    }

    @Override
    public void resume(WorkerRegistration worker, String operationId) {
        route(worker).resume(worker, operationId);
    }

    @Override
    public void cancel(WorkerRegistration worker, String operationId, String reason) {
        route(worker).cancel(worker, operationId, reason);
    }

    @Override
    public Optional<Operation> fetchOperation(WorkerRegistration worker, String operationId) {
        return route(worker).fetchOperation(worker, operationId);
    }

    @Override
    public MetricsPage fetchMetrics(WorkerRegistration worker, String operationId, int cursor) {
        return route(worker).fetchMetrics(worker, operationId, cursor);
    }

    private WorkerGateway route(WorkerRegistration worker) {
        return delegates.stream()
            .filter(g -> g.supports(worker))
            .findFirst()
            .orElseThrow(() -> new WorkerDispatchException(
                worker.workerId(), "no gateway for endpoint " + worker.endpointUrl()));
    }
}
