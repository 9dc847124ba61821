package com.quantops.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.exception.CheckpointStorageException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.engine.checkpoint.CheckpointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs checkpoint saves on a single coordination thread. Execution threads
 * block on the save with a bounded timeout; saves issued from the
 * coordination thread itself run inline.
 */
public class CheckpointWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointWriter.class);

    private final CheckpointService checkpointService;
    private final Duration saveTimeout;
    private final ExecutorService coordinator;
    private volatile Thread coordinatorThread;

    public CheckpointWriter(CheckpointService checkpointService, Duration saveTimeout) {
        this.checkpointService = checkpointService;
        this.saveTimeout = saveTimeout;
        this.coordinator = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "checkpoint-writer");
            thread.setDaemon(true);
            coordinatorThread = thread;
            return thread;
        });
    }

    /**
     * Save a checkpoint and wait for it to be durable.
     *
     * @throws CheckpointStorageException if the save fails, times out or is interrupted
     * @throws com.quantops.core.exception.ArtifactValidationException if required artifacts are invalid
     */
    public Checkpoint save(
            String operationId,
            CheckpointType type,
            JsonNode state,
            Map<String, byte[]> artifacts,
            ArtifactManifest manifest) {
        if (Thread.currentThread() == coordinatorThread) {
            return checkpointService.save(operationId, type, state, artifacts, manifest);
        }

        Future<Checkpoint> future = coordinator.submit(
            () -> checkpointService.save(operationId, type, state, artifacts, manifest));
        try {
            return future.get(saveTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CheckpointStorageException(operationId, "save timed out after " + saveTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CheckpointStorageException(operationId, "interrupted while saving", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new CheckpointStorageException(operationId, "save failed", e.getCause());
        }
    }

    public CheckpointService checkpointService() {
        return checkpointService;
    }

    @Override
    public void close() {
        coordinator.shutdown();
        try {
            if (!coordinator.awaitTermination(saveTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Checkpoint writer did not drain within {}", saveTimeout);
                coordinator.shutdownNow();
            }
        } catch (InterruptedException e) {
            coordinator.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
