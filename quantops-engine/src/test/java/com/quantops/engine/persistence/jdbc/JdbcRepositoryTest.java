package com.quantops.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.OptimisticLockException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationProgress;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.repository.OperationFilter;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * PostgreSQL-backed repository tests. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("quantops_test")
        .withUsername("test")
        .withPassword("test");

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private JdbcTemplate jdbcTemplate;
    private JdbcOperationRepository operations;
    private JdbcCheckpointRepository checkpoints;
    private ExecutorService executor;

    @BeforeAll
    void setUpSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema/quantops-schema.sql")).execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        operations = new JdbcOperationRepository(jdbcTemplate, objectMapper);
        checkpoints = new JdbcCheckpointRepository(jdbcTemplate, objectMapper);
        executor = Executors.newFixedThreadPool(10);
    }

    @AfterAll
    void tearDown() {
        executor.shutdown();
    }

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM operation_checkpoints");
        jdbcTemplate.update("DELETE FROM operations");
    }

    // ========== Operation Tests ==========

    @Test
    @DisplayName("Operations round-trip metadata and progress")
    void testSaveAndFind() {
        Operation op = Operation.create(OperationType.TRAINING, Map.of("symbol", "EURUSD", "epochs", 10),
                null, now())
            .withProgress(OperationProgress.of(12.5, "Epoch 1/10", now()));
        operations.save(op);

        Operation loaded = operations.findById(op.operationId()).orElseThrow();

        assertThat(loaded.status()).isEqualTo(OperationStatus.PENDING);
        assertThat(loaded.metadata()).containsEntry("symbol", "EURUSD").containsEntry("epochs", 10);
        assertThat(loaded.progress().percentage()).isEqualTo(12.5);
        assertThat(loaded.progress().message()).isEqualTo("Epoch 1/10");
        assertThat(loaded.version()).isEqualTo(op.version());
    }

    @Test
    @DisplayName("Saving an existing id is a conflict")
    void testDuplicateSave() {
        Operation op = Operation.create(OperationType.TRAINING, Map.of(), null, now());
        operations.save(op);

        assertThatThrownBy(() -> operations.save(op)).isInstanceOf(OperationConflictException.class);
    }

    @Test
    @DisplayName("Updates with a stale version are rejected")
    void testOptimisticLock() {
        Operation op = Operation.create(OperationType.TRAINING, Map.of(), null, now());
        operations.save(op);

        Operation running = op.toBuilder()
            .status(OperationStatus.RUNNING)
            .startedAt(Instant.now())
            .incrementVersion()
            .build();
        operations.update(running);

        assertThatThrownBy(() -> operations.update(running)).isInstanceOf(OptimisticLockException.class);
        assertThat(operations.findById(op.operationId()).orElseThrow().status()).isEqualTo(OperationStatus.RUNNING);
    }

    @Test
    @DisplayName("Exactly one concurrent resume wins the conditional update")
    void testConcurrentTryResume() throws Exception {
        Operation op = Operation.create(OperationType.TRAINING, Map.of(), null, now());
        operations.save(op);
        operations.update(op.toBuilder().status(OperationStatus.RUNNING).incrementVersion().build());
        Operation running = operations.findById(op.operationId()).orElseThrow();
        operations.update(running.toBuilder()
            .status(OperationStatus.FAILED)
            .errorMessage("worker crashed")
            .completedAt(Instant.now())
            .incrementVersion()
            .build());

        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(executor.submit(() -> {
                startLatch.await();
                return operations.tryResume(op.operationId(), Instant.now());
            }));
        }
        startLatch.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                winners++;
            }
        }

        Operation resumed = operations.findById(op.operationId()).orElseThrow();
        assertThat(winners).isEqualTo(1);
        assertThat(resumed.status()).isEqualTo(OperationStatus.RESUMING);
        assertThat(resumed.errorMessage()).isNull();
        assertThat(resumed.completedAt()).isNull();
    }

    @Test
    @DisplayName("Filters, counts and parent lookups")
    void testQueries() {
        Operation parent = Operation.create(OperationType.AGENT_RESEARCH, Map.of(), null, now());
        Operation child = Operation.create(OperationType.AGENT_DESIGN, Map.of(), parent.operationId(), now());
        operations.save(parent);
        operations.save(child);

        assertThat(operations.findByParent(parent.operationId()))
            .extracting(Operation::operationId).containsExactly(child.operationId());
        assertThat(operations.count(new OperationFilter(null, OperationType.AGENT_DESIGN, null, 10, 0)))
            .isEqualTo(1);
        assertThat(operations.countActive()).isEqualTo(2);
        assertThat(operations.countByStatus()).containsEntry(OperationStatus.PENDING, 2L);
        assertThat(operations.find(new OperationFilter(OperationStatus.PENDING, null, null, 1, 0))).hasSize(1);
    }

    // ========== Checkpoint Tests ==========

    @Test
    @DisplayName("Checkpoint upsert overwrites the single row per operation")
    void testCheckpointUpsert() {
        String operationId = "op_training_20240301_100000_ab12cd34";
        checkpoints.upsert(checkpoint(operationId, CheckpointType.PERIODIC, 3));
        checkpoints.upsert(checkpoint(operationId, CheckpointType.CANCELLATION, 5));

        Checkpoint loaded = checkpoints.findById(operationId).orElseThrow();

        assertThat(loaded.checkpointType()).isEqualTo(CheckpointType.CANCELLATION);
        assertThat(loaded.state().get("unit_index").asInt()).isEqualTo(5);
        assertThat(loaded.artifactsPath()).isEqualTo("/tmp/artifacts_" + operationId);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM operation_checkpoints", Integer.class))
            .isEqualTo(1);

        assertThat(checkpoints.delete(operationId)).isTrue();
        assertThat(checkpoints.exists(operationId)).isFalse();
    }

    private Checkpoint checkpoint(String operationId, CheckpointType type, int unitIndex) {
        return new Checkpoint(
            operationId,
            type,
            Instant.now(),
            objectMapper.createObjectNode().put("unit_index", unitIndex),
            "/tmp/artifacts_" + operationId,
            24,
            0,
            Map.of()
        );
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
