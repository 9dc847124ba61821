package com.quantops.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.exception.WorkerDispatchException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import com.quantops.core.model.WorkerRegistration;
import com.quantops.core.progress.MetricsPage;
import com.quantops.engine.dispatch.WorkerGateway;
import com.quantops.engine.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches to worker runtimes hosted in the orchestrator process.
 * Their registrations use endpoints of the form {@code local://<kind>}.
 */
public class LocalWorkerGateway implements WorkerGateway {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerGateway.class);

    private final Map<OperationType, WorkerRuntime> runtimes = new EnumMap<>(OperationType.class);

    public LocalWorkerGateway(List<WorkerRuntime> runtimes) {
        runtimes.forEach(r -> this.runtimes.put(r.operationType(), r));
    }

    /**
     * Host one more runtime. Used for runtimes whose function needs the
     * orchestrator built on top of this gateway; call before {@link #registerWith}.
     */
    public void host(WorkerRuntime runtime) {
        runtimes.put(runtime.operationType(), runtime);
    }

    /**
     * Register {@code slots} in-process workers per runtime and free them
     * whenever a run ends.
     */
    public void registerWith(WorkerRegistry workerRegistry, int slots, WorkerCapabilities capabilities) {
        for (WorkerRuntime runtime : runtimes.values()) {
            String kind = runtime.operationType().kind();
            for (int slot = 1; slot <= slots; slot++) {
                workerRegistry.register(kind + "-local-" + slot, runtime.operationType(),
                    WorkerRegistration.IN_PROCESS_SCHEME + kind, capabilities);
            }
            runtime.addCompletionListener(workerRegistry::releaseOperation);
        }
        log.info("Registered {} in-process worker slot(s) for {}", slots, runtimes.keySet());
    }

    @Override
    public boolean supports(WorkerRegistration worker) {
        return worker.isInProcess() && runtimes.containsKey(worker.workerType());
    }

    @Override
    public void start(WorkerRegistration worker, Operation operation, JsonNode request) {
        runtime(worker).start(request, operation.operationId(), operation.parentOperationId());
    }

    @Override
    public void resume(WorkerRegistration worker, String operationId) {
        runtime(worker).resume(operationId);
    }

    @Override
    public void cancel(WorkerRegistration worker, String operationId, String reason) {
        // The shared registry flips the run's token; nothing to forward
        log.debug("Cancel of in-process operation {} handled by the registry", operationId);
    }

    @Override
    public Optional<Operation> fetchOperation(WorkerRegistration worker, String operationId) {
        try {
            return Optional.of(runtime(worker).snapshot(operationId));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public MetricsPage fetchMetrics(WorkerRegistration worker, String operationId, int cursor) {
        return runtime(worker).metrics(operationId, cursor);
    }

    public Optional<WorkerRuntime> runtime(OperationType type) {
        return Optional.ofNullable(runtimes.get(type));
    }

    public List<WorkerRuntime> runtimes() {
        return List.copyOf(runtimes.values());
    }

    private WorkerRuntime runtime(WorkerRegistration worker) {
        WorkerRuntime runtime = runtimes.get(worker.workerType());
        if (runtime == null) {
            throw new WorkerDispatchException(worker.workerId(), "no in-process runtime for " + worker.workerType());
        }
        return runtime;
    }
}
