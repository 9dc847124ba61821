package com.quantops.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.agent.AgentProperties;
import com.quantops.agent.AgentResearchWorker;
import com.quantops.agent.AgentService;
import com.quantops.agent.QualityGates;
import com.quantops.core.checkpoint.CheckpointPolicy;
import com.quantops.core.model.OperationType;
import com.quantops.core.model.WorkerCapabilities;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.config.EngineConfiguration;
import com.quantops.engine.config.QuantOpsProperties;
import com.quantops.engine.coordinator.OperationOrchestrator;
import com.quantops.engine.coordinator.OperationRegistry;
import com.quantops.engine.dispatch.HttpWorkerGateway;
import com.quantops.engine.dispatch.RoutingWorkerGateway;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.registry.WorkerRegistry;
import com.quantops.examples.simulated.SimulatedFunctions;
import com.quantops.recovery.OrphanReconciler;
import com.quantops.worker.CheckpointWriter;
import com.quantops.worker.GracefulShutdownHandler;
import com.quantops.worker.LocalWorkerGateway;
import com.quantops.worker.OperationFunction;
import com.quantops.worker.WorkerRuntime;
import com.quantops.worker.web.ApiExceptionHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrator wiring: in-process simulated runtimes plus HTTP dispatch to
 * registered standalone workers, the research cycle runtime, and the
 * reconciliation sweep.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
@Import({EngineConfiguration.class, ApiExceptionHandler.class})
public class OrchestratorConfiguration {

    private static final List<OperationType> LEAF_TYPES = List.of(
        OperationType.TRAINING, OperationType.BACKTESTING,
        OperationType.AGENT_DESIGN, OperationType.AGENT_ASSESSMENT);

    // Closed by the shutdown handler after the loops stop
    @Bean(destroyMethod = "")
    public CheckpointWriter checkpointWriter(CheckpointService checkpointService, QuantOpsProperties properties) {
        return new CheckpointWriter(checkpointService, properties.checkpoint().saveTimeout());
    }

    @Bean
    public LocalWorkerGateway localWorkerGateway(
            OperationRegistry operations,
            CheckpointWriter checkpointWriter,
            QuantOpsProperties properties,
            OperationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        List<WorkerRuntime> runtimes = new ArrayList<>();
        for (OperationType type : LEAF_TYPES) {
            runtimes.add(runtime(type, SimulatedFunctions.forType(type), properties.workers().localSlots(),
                operations, checkpointWriter, properties, metrics, objectMapper, clock));
        }
        return new LocalWorkerGateway(runtimes);
    }

    @Bean
    public HttpWorkerGateway httpWorkerGateway(ObjectMapper objectMapper) {
        return new HttpWorkerGateway(objectMapper);
    }

    @Bean
    public OperationOrchestrator operationOrchestrator(
            OperationRegistry operations,
            WorkerRegistry workers,
            LocalWorkerGateway localWorkerGateway,
            HttpWorkerGateway httpWorkerGateway,
            CheckpointService checkpointService,
            ObjectMapper objectMapper) {
        RoutingWorkerGateway gateway = new RoutingWorkerGateway(List.of(localWorkerGateway, httpWorkerGateway));
        return new OperationOrchestrator(operations, workers, gateway, checkpointService, objectMapper);
    }

    @Bean
    public QualityGates qualityGates(AgentProperties agentProperties, OperationMetrics metrics) {
        return new QualityGates(agentProperties.gates(), metrics);
    }

    /**
     * The research runtime needs the orchestrator, so it joins the local
     * gateway after the orchestrator exists; local slots are registered here.
     */
    @Bean(destroyMethod = "")
    public WorkerRuntime researchRuntime(
            LocalWorkerGateway localWorkerGateway,
            OperationOrchestrator orchestrator,
            OperationRegistry operations,
            WorkerRegistry workers,
            QualityGates qualityGates,
            CheckpointWriter checkpointWriter,
            QuantOpsProperties properties,
            AgentProperties agentProperties,
            OperationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        AgentResearchWorker research = new AgentResearchWorker(
            operations, orchestrator, qualityGates, agentProperties.pollInterval(), objectMapper);
        int slots = Math.max(properties.workers().localSlots(), agentProperties.maxConcurrentCycles());
        WorkerRuntime runtime = runtime(OperationType.AGENT_RESEARCH, research, slots,
            operations, checkpointWriter, properties, metrics, objectMapper, clock);
        localWorkerGateway.host(runtime);
        localWorkerGateway.registerWith(workers, slots, WorkerCapabilities.cpuOnly());
        return runtime;
    }

    @Bean
    public AgentService agentService(
            OperationRegistry operations,
            OperationOrchestrator orchestrator,
            AgentProperties agentProperties,
            WorkerRuntime researchRuntime) {
        return new AgentService(operations, orchestrator, agentProperties.maxConcurrentCycles());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public OrphanReconciler orphanReconciler(
            OperationRegistry operations,
            OperationOrchestrator orchestrator,
            WorkerRegistry workers,
            OperationMetrics metrics,
            QuantOpsProperties properties,
            Clock clock) {
        return new OrphanReconciler(operations, orchestrator, workers, metrics, properties.recovery(), clock);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(
            LocalWorkerGateway localWorkerGateway,
            WorkerRuntime researchRuntime,
            CheckpointWriter checkpointWriter,
            QuantOpsProperties properties) {
        // Research first, so cycles checkpoint before their children are stopped
        List<WorkerRuntime> runtimes = new ArrayList<>();
        runtimes.add(researchRuntime);
        localWorkerGateway.runtimes().stream()
            .filter(r -> r != researchRuntime)
            .forEach(runtimes::add);
        return new GracefulShutdownHandler(runtimes, checkpointWriter, null, properties.workers().shutdownTimeout());
    }

    private static WorkerRuntime runtime(
            OperationType type,
            OperationFunction function,
            int threads,
            OperationRegistry operations,
            CheckpointWriter checkpointWriter,
            QuantOpsProperties properties,
            OperationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        QuantOpsProperties.Checkpoint cadence = properties.checkpoint();
        return new WorkerRuntime(
            type, function, operations, checkpointWriter,
            () -> new CheckpointPolicy(cadence.unitInterval(), cadence.timeInterval(), clock),
            WorkerRuntime.newExecutor(type, Math.max(threads, 1)),
            metrics, objectMapper, clock);
    }
}
