package com.quantops.worker;

import com.quantops.core.model.WorkerCapabilities;

import java.util.Map;

/**
 * Detects the hardware a worker reports at registration.
 *
 * Priority: a specialized accelerator named in {@code QUANTOPS_ACCELERATOR}
 * (e.g. {@code mps}), then generic GPUs listed in {@code CUDA_VISIBLE_DEVICES}
 * or {@code NVIDIA_VISIBLE_DEVICES}, then CPU only.
 */
public class CapabilityDetector {

    public static final String ACCELERATOR_ENV = "QUANTOPS_ACCELERATOR";
    public static final String CUDA_ENV = "CUDA_VISIBLE_DEVICES";
    public static final String NVIDIA_ENV = "NVIDIA_VISIBLE_DEVICES";

    private final Map<String, String> environment;

    public CapabilityDetector() {
        this(System.getenv());
    }

    public CapabilityDetector(Map<String, String> environment) {
        this.environment = environment;
    }

    public WorkerCapabilities detect() {
        String accelerator = value(ACCELERATOR_ENV);
        if (accelerator != null && !accelerator.equalsIgnoreCase("cpu")) {
            return WorkerCapabilities.accelerator(accelerator.toLowerCase(), 1);
        }

        String devices = value(CUDA_ENV) != null ? value(CUDA_ENV) : value(NVIDIA_ENV);
        if (devices != null && !devices.equalsIgnoreCase("none") && !devices.equals("-1")) {
            int count = devices.equalsIgnoreCase("all") ? 1 : devices.split(",").length;
            return WorkerCapabilities.accelerator("cuda", count);
        }
        return WorkerCapabilities.cpuOnly();
    }

    private String value(String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
