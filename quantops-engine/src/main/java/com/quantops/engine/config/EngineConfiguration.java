package com.quantops.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.repository.CheckpointRepository;
import com.quantops.core.repository.OperationRepository;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.coordinator.OperationRegistry;
import com.quantops.engine.health.OrchestratorHealthIndicator;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.persistence.InMemoryCheckpointRepository;
import com.quantops.engine.persistence.InMemoryOperationRepository;
import com.quantops.engine.persistence.jdbc.JdbcCheckpointRepository;
import com.quantops.engine.persistence.jdbc.JdbcOperationRepository;
import com.quantops.engine.registry.WorkerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Operation store, checkpoint store and worker registry shared by the
 * orchestrator and standalone workers.
 *
 * {@code quantops.persistence=memory} keeps everything in process;
 * {@code jdbc} uses the configured DataSource (PostgreSQL).
 */
@Configuration
@EnableConfigurationProperties(QuantOpsProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.application.name:quantops}") String application) {
        return registry -> registry.config().commonTags("application", application);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationMetrics operationMetrics(MeterRegistry meterRegistry) {
        return new OperationMetrics(meterRegistry);
    }

    @Bean
    public CheckpointService checkpointService(
            CheckpointRepository checkpointRepository,
            ObjectMapper objectMapper,
            OperationMetrics metrics,
            QuantOpsProperties properties,
            Clock clock) {
        Path artifactsRoot = Path.of(properties.checkpoint().artifactsDir()).toAbsolutePath();
        try {
            Files.createDirectories(artifactsRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create checkpoint artifacts directory " + artifactsRoot, e);
        }
        log.info("Checkpoint artifacts stored under {}", artifactsRoot);
        return new CheckpointService(checkpointRepository, objectMapper, artifactsRoot, metrics, clock);
    }

    @Bean
    public OperationRegistry operationRegistry(
            OperationRepository operationRepository,
            CheckpointService checkpointService,
            OperationMetrics metrics,
            Clock clock) {
        return new OperationRegistry(operationRepository, checkpointService, metrics, clock);
    }

    @Bean
    public WorkerRegistry workerRegistry(QuantOpsProperties properties, Clock clock) {
        QuantOpsProperties.Workers workers = properties.workers();
        return new WorkerRegistry(clock, workers.heartbeatTimeout(), workers.removalThreshold());
    }

    @Bean
    public OrchestratorHealthIndicator orchestratorHealthIndicator(
            OperationRepository operationRepository,
            WorkerRegistry workerRegistry,
            CheckpointService checkpointService) {
        return new OrchestratorHealthIndicator(operationRepository, workerRegistry, checkpointService);
    }

    // ========== Persistence ==========

    @Configuration
    @ConditionalOnProperty(name = "quantops.persistence", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public OperationRepository operationRepository() {
            log.info("Using in-memory operation and checkpoint storage");
            return new InMemoryOperationRepository();
        }

        @Bean
        public CheckpointRepository checkpointRepository() {
            return new InMemoryCheckpointRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "quantops.persistence", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public OperationRepository operationRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            log.info("Using JDBC operation and checkpoint storage");
            return new JdbcOperationRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public CheckpointRepository checkpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcCheckpointRepository(jdbcTemplate, objectMapper);
        }
    }
}
