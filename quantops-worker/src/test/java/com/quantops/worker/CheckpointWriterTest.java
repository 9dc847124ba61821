package com.quantops.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.exception.ArtifactValidationException;
import com.quantops.core.exception.CheckpointStorageException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.test.TimeController;
import com.quantops.engine.checkpoint.CheckpointService;
import com.quantops.engine.metrics.OperationMetrics;
import com.quantops.engine.persistence.InMemoryCheckpointRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CheckpointWriterTest {

    @TempDir
    Path artifactsRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TimeController time = new TimeController();
    private CheckpointWriter writer;

    @AfterEach
    void tearDown() {
        if (writer != null) {
            writer.close();
        }
    }

    private CheckpointService service(InMemoryCheckpointRepository repository) {
        return new CheckpointService(repository, objectMapper, artifactsRoot, OperationMetrics.noop(), time);
    }

    @Test
    @DisplayName("Saves run on the coordination thread and return the stored row")
    void testSaveOnCoordinator() {
        InMemoryCheckpointRepository repository = new InMemoryCheckpointRepository();
        writer = new CheckpointWriter(service(repository), Duration.ofSeconds(5));

        Checkpoint saved = writer.save("op_1", CheckpointType.PERIODIC,
            objectMapper.createObjectNode().put("unit_index", 4), Map.of(), ArtifactManifest.NONE);

        assertThat(saved.checkpointType()).isEqualTo(CheckpointType.PERIODIC);
        assertThat(repository.findById("op_1")).isPresent();
    }

    @Test
    @DisplayName("A save that exceeds the timeout raises a storage error")
    void testSaveTimeout() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        InMemoryCheckpointRepository slow = new InMemoryCheckpointRepository() {
            @Override
            public void upsert(Checkpoint checkpoint) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.upsert(checkpoint);
            }
        };
        writer = new CheckpointWriter(service(slow), Duration.ofMillis(100));

        try {
            assertThatThrownBy(() -> writer.save("op_slow", CheckpointType.PERIODIC,
                objectMapper.createObjectNode(), Map.of(), ArtifactManifest.NONE))
                .isInstanceOf(CheckpointStorageException.class)
                .hasMessageContaining("timed out");
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Validation errors reach the caller unchanged")
    void testValidationPropagates() {
        writer = new CheckpointWriter(service(new InMemoryCheckpointRepository()), Duration.ofSeconds(5));

        assertThatThrownBy(() -> writer.save("op_model", CheckpointType.PERIODIC,
            objectMapper.createObjectNode(), Map.of("model.pt", new byte[] {1}), ArtifactManifest.MODEL_CHECKPOINT))
            .isInstanceOf(ArtifactValidationException.class)
            .hasMessageContaining("optimizer.pt (missing)");
    }
}
