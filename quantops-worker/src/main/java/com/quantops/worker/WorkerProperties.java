package com.quantops.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Standalone worker settings bound from {@code quantops.worker.*}.
 *
 * <pre>
 * quantops:
 *   worker:
 *     orchestrator-url: http://orchestrator:8080
 *     kind: training
 *     public-endpoint: http://training-worker-1:5003
 * </pre>
 */
@ConfigurationProperties(prefix = "quantops.worker")
public record WorkerProperties(
    @DefaultValue("http://localhost:8080") String orchestratorUrl,
    String workerId,
    @DefaultValue("training") String kind,
    @DefaultValue("http://localhost:5003") String publicEndpoint,
    @DefaultValue("30s") Duration heartbeatInterval,
    @DefaultValue("1") int threads,
    @DefaultValue("30s") Duration shutdownTimeout
) {}
