package com.quantops.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops a worker process without losing completed units.
 *
 * On shutdown:
 * 1. Stops heartbeats so the orchestrator stops routing work here
 * 2. Cancels every active run with a shutdown token; loops save a
 *    {@code shutdown} checkpoint at their next unit boundary
 * 3. Waits for the loops to exit (bounded)
 * 4. Drains pending checkpoint writes
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final List<WorkerRuntime> runtimes;
    private final CheckpointWriter checkpointWriter;
    private final OrchestratorClient orchestratorClient;
    private final Duration timeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * @param orchestratorClient Heartbeat client of a standalone worker, null when hosted in the orchestrator
     */
    public GracefulShutdownHandler(
            List<WorkerRuntime> runtimes,
            CheckpointWriter checkpointWriter,
            OrchestratorClient orchestratorClient,
            Duration timeout) {
        this.runtimes = runtimes;
        this.checkpointWriter = checkpointWriter;
        this.orchestratorClient = orchestratorClient;
        this.timeout = timeout;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        shutdown();
    }

    /**
     * Run the shutdown sequence once; later calls return immediately.
     *
     * @return Operation ids whose loops did not exit within the timeout
     */
    public List<String> shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return List.of();
        }
        log.info("Initiating graceful shutdown of {} runtime(s) (timeout: {})", runtimes.size(), timeout);

        if (orchestratorClient != null) {
            orchestratorClient.stop();
        }

        List<String> unfinished = new ArrayList<>();
        for (WorkerRuntime runtime : runtimes) {
            try {
                List<String> remaining = runtime.shutdown(timeout);
                if (!remaining.isEmpty()) {
                    log.warn("Shutdown timeout reached with {} {} run(s) still active: {}",
                        remaining.size(), runtime.operationType(), remaining);
                }
                unfinished.addAll(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} runs to stop", runtime.operationType());
                unfinished.addAll(runtime.activeOperationIds());
            }
        }

        checkpointWriter.close();

        if (unfinished.isEmpty()) {
            log.info("Graceful shutdown complete");
        } else {
            log.warn("Graceful shutdown finished with {} run(s) still active", unfinished.size());
        }
        return unfinished;
    }
}
