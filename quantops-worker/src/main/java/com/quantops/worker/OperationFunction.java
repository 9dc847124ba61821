package com.quantops.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.checkpoint.ArtifactManifest;

/**
 * Long-running unit-based job executed by a {@link WorkerRuntime}.
 */
@FunctionalInterface
public interface OperationFunction {

    /**
     * Run the job.
     *
     * Implementations write progress at least once per unit, call
     * {@link ExecutionContext#checkpointIfDue} after each completed unit and
     * check {@link ExecutionContext#isCancelled()} at unit boundaries. On a
     * resumed run, {@link ExecutionContext#startUnit()} is the first unit to run.
     *
     * @param context Request, progress, cancellation and checkpoint access
     * @return The result summary recorded on the completed operation
     * @throws DomainException if the job fails for a domain reason
     */
    JsonNode execute(ExecutionContext context) throws DomainException;

    /**
     * Artifacts this function's checkpoints must carry.
     */
    default ArtifactManifest artifactManifest() {
        return ArtifactManifest.NONE;
    }
}
