package com.quantops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hardware capabilities a worker reports at registration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerCapabilities(
    boolean gpu,
    @JsonProperty("gpu_type") String gpuType,
    @JsonProperty("gpu_count") int gpuCount
) {
    public static WorkerCapabilities cpuOnly() {
        return new WorkerCapabilities(false, "cpu", 0);
    }

    public static WorkerCapabilities accelerator(String gpuType, int gpuCount) {
        return new WorkerCapabilities(true, gpuType, Math.max(1, gpuCount));
    }
}
