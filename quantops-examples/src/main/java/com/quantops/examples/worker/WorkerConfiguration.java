package com.quantops.examples.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.model.OperationType;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.config.EngineConfiguration;
import com.quantops.engine.config.QuantOpsProperties;
import com.quantops.engine.coordinator.OperationRegistry;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.examples.simulated.SimulatedFunctions;
import com.quantops.worker.CapabilityDetector;
import com.quantops.worker.CheckpointWriter;
import com.quantops.worker.GracefulShutdownHandler;
import com.quantops.worker.OrchestratorClient;
import com.quantops.worker.WorkerProperties;
import com.quantops.worker.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.List;

/**
 * Wires a single simulated runtime behind the worker HTTP surface and keeps
 * it registered with the orchestrator.
 */
@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
@Import(EngineConfiguration.class)
public class WorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfiguration.class);

    @Bean
    public OperationType workerType(WorkerProperties properties) {
        OperationType type = OperationType.fromKind(properties.kind())
            .orElseThrow(() -> new IllegalStateException("Unknown worker kind: " + properties.kind()));
        if (type == OperationType.AGENT_RESEARCH) {
            throw new IllegalStateException("Research cycles run inside the orchestrator, not in a standalone worker");
        }
        return type;
    }

    // Closed by the shutdown handler after the loops stop
    @Bean(destroyMethod = "")
    public CheckpointWriter checkpointWriter(CheckpointService checkpointService, QuantOpsProperties properties) {
        return new CheckpointWriter(checkpointService, properties.checkpoint().saveTimeout());
    }

    @Bean(destroyMethod = "")
    public WorkerRuntime workerRuntime(
            OperationType workerType,
            OperationRegistry operations,
            CheckpointWriter checkpointWriter,
            WorkerProperties workerProperties,
            QuantOpsProperties properties,
            OperationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        QuantOpsProperties.Checkpoint cadence = properties.checkpoint();
        return new WorkerRuntime(
            workerType, SimulatedFunctions.forType(workerType), operations, checkpointWriter,
            () -> new CheckpointPolicy(cadence.unitInterval(), cadence.timeInterval(), clock),
            WorkerRuntime.newExecutor(workerType, workerProperties.threads()),
            metrics, objectMapper, clock);
    }

    @Bean
    public OrchestratorClient orchestratorClient(
            OperationType workerType,
            WorkerProperties properties,
            ObjectMapper objectMapper) {
        String workerId = properties.workerId() != null
            ? properties.workerId()
            : workerType.kind() + "-" + hostname();
        return new OrchestratorClient(
            properties.orchestratorUrl(), workerId, workerType, properties.publicEndpoint(),
            new CapabilityDetector().detect(), objectMapper);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(
            List<WorkerRuntime> runtimes,
            CheckpointWriter checkpointWriter,
            OrchestratorClient orchestratorClient,
            WorkerProperties properties) {
        return new GracefulShutdownHandler(runtimes, checkpointWriter, orchestratorClient, properties.shutdownTimeout());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerWithOrchestrator(ApplicationReadyEvent event) {
        WorkerProperties properties = event.getApplicationContext().getBean(WorkerProperties.class);
        log.info("Worker ready; registering with orchestrator at {}", properties.orchestratorUrl());
        event.getApplicationContext().getBean(OrchestratorClient.class).start(properties.heartbeatInterval());
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve hostname, using 'worker': {}", e.getMessage());
            return "worker";
        }
    }
}
