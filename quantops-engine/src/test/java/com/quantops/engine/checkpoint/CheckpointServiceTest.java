package com.quantops.engine.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.exception.ArtifactValidationException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.test.TimeController;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.persistence.InMemoryCheckpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class CheckpointServiceTest {

    private static final String OPERATION_ID = "op_training_20240301_100000_ab12cd34";

    @TempDir
    Path artifactsRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TimeController time;
    private InMemoryCheckpointRepository repository;
    private OperationMetrics metrics;
    private CheckpointService service;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-03-01T10:00:00Z"));
        repository = new InMemoryCheckpointRepository();
        metrics = OperationMetrics.noop();
        service = new CheckpointService(repository, objectMapper, artifactsRoot, metrics, time);
    }

    @Test
    @DisplayName("State-only checkpoints round-trip without an artifacts directory")
    void testSaveStateOnly() {
        ObjectNode state = envelope(3);

        Checkpoint saved = service.save(OPERATION_ID, CheckpointType.PERIODIC, state);
        Checkpoint loaded = service.load(OPERATION_ID, true).orElseThrow();

        assertThat(saved.hasArtifacts()).isFalse();
        assertThat(saved.stateSizeBytes()).isPositive();
        assertThat(loaded.state()).isEqualTo(state);
        assertThat(loaded.checkpointType()).isEqualTo(CheckpointType.PERIODIC);
        assertThat(loaded.createdAt()).isEqualTo(time.instant());
        assertThat(metrics.registry().counter(OperationMetrics.CHECKPOINT_SAVES, "type", "periodic").count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Artifacts are read back byte-for-byte")
    void testArtifactsRoundTrip() {
        byte[] model = randomBytes(4096);
        byte[] optimizer = randomBytes(1024);
        Map<String, byte[]> artifacts = new LinkedHashMap<>();
        artifacts.put("model.pt", model);
        artifacts.put("optimizer.pt", optimizer);

        Checkpoint saved = service.save(
            OPERATION_ID, CheckpointType.CANCELLATION, envelope(5), artifacts, ArtifactManifest.MODEL_CHECKPOINT);
        Checkpoint loaded = service.require(OPERATION_ID);

        assertThat(saved.artifactsSizeBytes()).isEqualTo(5120);
        assertThat(Path.of(saved.artifactsPath()).getFileName().toString()).startsWith("artifacts_");
        assertThat(loaded.artifacts()).containsOnlyKeys("model.pt", "optimizer.pt");
        assertThat(loaded.artifacts().get("model.pt")).isEqualTo(model);
        assertThat(loaded.artifacts().get("optimizer.pt")).isEqualTo(optimizer);
        assertThat(ResumeContext.fromCheckpoint(loaded).resumeFromUnit()).isEqualTo(5);
    }

    @Test
    @DisplayName("Loading without artifacts skips the blobs")
    void testLoadWithoutArtifacts() {
        service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(1),
            Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {2}), ArtifactManifest.MODEL_CHECKPOINT);

        Checkpoint row = service.load(OPERATION_ID, false).orElseThrow();

        assertThat(row.hasArtifacts()).isTrue();
        assertThat(row.artifacts()).isEmpty();
    }

    @Test
    @DisplayName("Saving again overwrites state and replaces artifacts")
    void testOverwrite() throws IOException {
        service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(2),
            Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {1}, "scheduler.pt", new byte[] {1}),
            ArtifactManifest.MODEL_CHECKPOINT);
        time.advanceSeconds(60);

        service.save(OPERATION_ID, CheckpointType.CANCELLATION, envelope(4),
            Map.of("model.pt", new byte[] {9}, "optimizer.pt", new byte[] {9}),
            ArtifactManifest.MODEL_CHECKPOINT);

        Checkpoint loaded = service.require(OPERATION_ID);
        assertThat(loaded.checkpointType()).isEqualTo(CheckpointType.CANCELLATION);
        assertThat(loaded.state().get(ResumeContext.UNIT_INDEX).asInt()).isEqualTo(4);
        assertThat(loaded.artifacts()).containsOnlyKeys("model.pt", "optimizer.pt");
        assertThat(loaded.artifacts().get("model.pt")).containsExactly(9);
        assertThat(directoryNames()).containsExactly(Path.of(loaded.artifactsPath()).getFileName().toString());
    }

    @Test
    @DisplayName("A failed overwrite keeps the previous checkpoint and its artifacts loadable")
    void testFailedOverwriteKeepsPrevious() throws IOException {
        service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(2),
            Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {2}), ArtifactManifest.MODEL_CHECKPOINT);
        String directory = Path.of(service.require(OPERATION_ID).artifactsPath()).getFileName().toString();

        assertThatThrownBy(() -> service.save(OPERATION_ID, CheckpointType.CANCELLATION, envelope(4),
                Map.of("model.pt", new byte[] {9}, "optimizer.pt", new byte[] {9}, "../escape.pt", new byte[] {9}),
                ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(IllegalArgumentException.class);

        Checkpoint loaded = service.require(OPERATION_ID);
        assertThat(loaded.state().get(ResumeContext.UNIT_INDEX).asInt()).isEqualTo(2);
        assertThat(loaded.artifacts().get("model.pt")).containsExactly(1);
        assertThat(loaded.artifacts().get("optimizer.pt")).containsExactly(2);
        assertThat(directoryNames()).containsExactly(directory);
    }

    @Test
    @DisplayName("A failed row write on overwrite restores the previous artifacts directory")
    void testRowFailureOnOverwriteRestoresPrevious() throws IOException {
        AtomicBoolean rowWritesFail = new AtomicBoolean(false);
        InMemoryCheckpointRepository flaky = new InMemoryCheckpointRepository() {
            @Override
            public void upsert(Checkpoint checkpoint) {
                if (rowWritesFail.get()) {
                    throw new IllegalStateException("database unavailable");
                }
                super.upsert(checkpoint);
            }
        };
        CheckpointService flakyService = new CheckpointService(flaky, objectMapper, artifactsRoot, metrics, time);
        flakyService.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(2),
            Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {2}), ArtifactManifest.MODEL_CHECKPOINT);
        String directory = Path.of(flakyService.require(OPERATION_ID).artifactsPath()).getFileName().toString();

        rowWritesFail.set(true);
        assertThatThrownBy(() -> flakyService.save(OPERATION_ID, CheckpointType.CANCELLATION, envelope(4),
                Map.of("model.pt", new byte[] {9}, "optimizer.pt", new byte[] {9}), ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(IllegalStateException.class);

        Checkpoint loaded = flakyService.require(OPERATION_ID);
        assertThat(loaded.state().get(ResumeContext.UNIT_INDEX).asInt()).isEqualTo(2);
        assertThat(loaded.artifacts().get("model.pt")).containsExactly(1);
        assertThat(directoryNames()).containsExactly(directory);
    }

    @Test
    @DisplayName("A save without artifacts is rejected when the manifest requires them")
    void testManifestValidationWithoutArtifacts() {
        assertThatThrownBy(() -> service.save(OPERATION_ID, CheckpointType.CANCELLATION, envelope(3),
                Map.of(), ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(ArtifactValidationException.class)
            .satisfies(e -> assertThat(((ArtifactValidationException) e).getInvalidArtifacts())
                .containsExactly("model.pt (missing)", "optimizer.pt (missing)"));

        assertThat(service.exists(OPERATION_ID)).isFalse();
    }

    @Test
    @DisplayName("Missing or empty required artifacts are rejected before anything is written")
    void testManifestValidation() throws IOException {
        assertThatThrownBy(() -> service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(1),
                Map.of("model.pt", new byte[0]), ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(ArtifactValidationException.class)
            .satisfies(e -> assertThat(((ArtifactValidationException) e).getInvalidArtifacts())
                .containsExactly("model.pt (empty)", "optimizer.pt (missing)"));

        assertThat(service.exists(OPERATION_ID)).isFalse();
        assertThat(directoryNames()).isEmpty();
    }

    @Test
    @DisplayName("A failed row write removes the new artifacts directory")
    void testRollbackOnRowFailure() throws IOException {
        CheckpointService failing = new CheckpointService(new InMemoryCheckpointRepository() {
            @Override
            public void upsert(Checkpoint checkpoint) {
                throw new IllegalStateException("database unavailable");
            }
        }, objectMapper, artifactsRoot, metrics, time);

        assertThatThrownBy(() -> failing.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(1),
                Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {1}), ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(IllegalStateException.class);

        assertThat(directoryNames()).isEmpty();
    }

    @Test
    @DisplayName("Delete removes row and directory and is idempotent")
    void testDelete() throws IOException {
        service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(1),
            Map.of("model.pt", new byte[] {1}, "optimizer.pt", new byte[] {1}), ArtifactManifest.MODEL_CHECKPOINT);

        assertThat(service.delete(OPERATION_ID)).isTrue();
        assertThat(service.delete(OPERATION_ID)).isFalse();
        assertThat(service.exists(OPERATION_ID)).isFalse();
        assertThat(directoryNames()).isEmpty();
        assertThatThrownBy(() -> service.require(OPERATION_ID)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Concurrent saves and deletes of one operation leave a consistent checkpoint")
    void testConcurrentSaveAndDelete() throws Exception {
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    if ((i + thread) % 3 == 0) {
                        service.delete(OPERATION_ID);
                    } else {
                        byte value = (byte) (i + 1);
                        service.save(OPERATION_ID, CheckpointType.PERIODIC, envelope(i),
                            Map.of("model.pt", new byte[] {value}, "optimizer.pt", new byte[] {value}),
                            ArtifactManifest.MODEL_CHECKPOINT);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        if (service.exists(OPERATION_ID)) {
            Checkpoint loaded = service.require(OPERATION_ID);
            assertThat(loaded.artifacts().get("model.pt")).isEqualTo(loaded.artifacts().get("optimizer.pt"));
            assertThat(directoryNames()).containsExactly(Path.of(loaded.artifactsPath()).getFileName().toString());
        } else {
            assertThat(directoryNames()).isEmpty();
        }
    }

    private ObjectNode envelope(int unitIndex) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(ResumeContext.UNIT_INDEX, unitIndex);
        envelope.putObject(ResumeContext.ORIGINAL_REQUEST).put("symbol", "EURUSD");
        envelope.putObject(ResumeContext.STATE).put("best_val_loss", 0.42);
        return envelope;
    }

    private List<String> directoryNames() throws IOException {
        try (Stream<Path> entries = Files.list(artifactsRoot)) {
            return entries.map(p -> p.getFileName().toString()).toList();
        }
    }

    private static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        new Random(42).nextBytes(bytes);
        return bytes;
    }
}
