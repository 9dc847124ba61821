package com.quantops.engine.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.exception.CheckpointStorageException;
import com.quantops.core.exception.NotFoundException;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.repository.CheckpointRepository;
import com.quantops.engine.metrics.OperationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Durable checkpoint store: one row per operation plus an optional artifacts
 * directory on the filesystem.
 *
 * Artifact directories are written into a temp directory under the artifacts
 * root and moved into place as {@code artifacts_<operationId>}, so a reader
 * never sees a half-written directory. The directory being replaced is kept
 * aside until the new row is stored; if the save fails it is moved back and
 * the previous checkpoint stays loadable.
 */
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private static final String TEMP_PREFIX = "checkpoint_temp_";
    private static final String ARTIFACTS_PREFIX = "artifacts_";
    private static final String PREVIOUS_PREFIX = "checkpoint_previous_";

    private final CheckpointRepository repository;
    private final ObjectMapper objectMapper;
    private final Path artifactsRoot;
    private final OperationMetrics metrics;
    private final Clock clock;
    private final Map<String, Object> operationLocks = new ConcurrentHashMap<>();

    public CheckpointService(
            CheckpointRepository repository,
            ObjectMapper objectMapper,
            Path artifactsRoot,
            OperationMetrics metrics,
            Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.artifactsRoot = artifactsRoot;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Save a checkpoint without artifacts.
     */
    public Checkpoint save(String operationId, CheckpointType type, JsonNode state) {
        return save(operationId, type, state, Map.of(), ArtifactManifest.NONE);
    }

    /**
     * Save (overwrite) the checkpoint of an operation.
     *
     * @param operationId The owning operation
     * @param type Why the checkpoint is written
     * @param state Domain state envelope
     * @param artifacts Binary artifacts by file name, may be empty
     * @param manifest Required/optional artifact names to validate against
     * @return The stored checkpoint row
     * @throws com.quantops.core.exception.ArtifactValidationException if required artifacts are missing or empty
     * @throws CheckpointStorageException if the row or the artifacts cannot be written
     */
    public Checkpoint save(
            String operationId,
            CheckpointType type,
            JsonNode state,
            Map<String, byte[]> artifacts,
            ArtifactManifest manifest) {
        Instant started = clock.instant();
        manifest.validate(operationId, artifacts);

        synchronized (lockFor(operationId)) {
            long stateSize = stateSize(operationId, state);
            Path target = artifactsDirectory(operationId);
            Path staged = null;
            Path previous = null;
            boolean installed = false;
            long artifactsSize = 0;

            try {
                if (!artifacts.isEmpty()) {
                    staged = stageArtifacts(artifacts);
                    artifactsSize = artifacts.values().stream().mapToLong(b -> b.length).sum();
                }
                previous = setAside(operationId, target);
                if (staged != null) {
                    move(staged, target);
                    installed = true;
                }

                Checkpoint checkpoint = new Checkpoint(
                    operationId,
                    type,
                    clock.instant(),
                    state,
                    installed ? target.toString() : null,
                    stateSize,
                    artifactsSize,
                    Map.of()
                );
                repository.upsert(checkpoint);
                removeQuietly(operationId, previous);

                metrics.checkpointSaved(type, Duration.between(started, clock.instant()));
                log.debug("Saved {} checkpoint for {} ({} state bytes, {} artifact bytes)",
                    type.wireName(), operationId, stateSize, artifactsSize);
                return checkpoint;

            } catch (IOException | UncheckedIOException e) {
                rollBack(operationId, staged, installed ? target : null, previous, target);
                throw new CheckpointStorageException(operationId, "failed to write artifacts", e);
            } catch (RuntimeException e) {
                rollBack(operationId, staged, installed ? target : null, previous, target);
                throw e;
            }
        }
    }

    /**
     * Load the checkpoint of an operation.
     *
     * @param includeArtifacts Whether to read artifact blobs from disk
     */
    public Optional<Checkpoint> load(String operationId, boolean includeArtifacts) {
        Optional<Checkpoint> row = repository.findById(operationId);
        if (row.isEmpty() || !includeArtifacts || !row.get().hasArtifacts()) {
            return row;
        }
        Checkpoint checkpoint = row.get();
        return Optional.of(checkpoint.withArtifacts(readArtifacts(checkpoint)));
    }

    /**
     * Load the checkpoint of an operation including artifacts, or fail.
     *
     * @throws NotFoundException if the operation has no checkpoint
     */
    public Checkpoint require(String operationId) {
        return load(operationId, true)
            .orElseThrow(() -> new NotFoundException("Checkpoint", operationId));
    }

    /**
     * Delete the checkpoint row and artifacts of an operation. Idempotent.
     *
     * @return true if a row existed
     */
    public boolean delete(String operationId) {
        synchronized (lockFor(operationId)) {
            boolean deleted = repository.delete(operationId);
            try {
                deleteArtifactsDirectory(operationId);
            } catch (IOException e) {
                throw new CheckpointStorageException(operationId, "failed to delete artifacts", e);
            }
            if (deleted) {
                log.debug("Deleted checkpoint for {}", operationId);
            }
            return deleted;
        }
    }

    public boolean exists(String operationId) {
        return repository.exists(operationId);
    }

    public Path artifactsRoot() {
        return artifactsRoot;
    }

    // ========== Helper Methods ==========

    private Object lockFor(String operationId) {
        return operationLocks.computeIfAbsent(operationId, id -> new Object());
    }

    private long stateSize(String operationId, JsonNode state) {
        try {
            return objectMapper.writeValueAsBytes(state).length;
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException(operationId, "state is not serializable", e);
        }
    }

    private Path stageArtifacts(Map<String, byte[]> artifacts) throws IOException {
        Files.createDirectories(artifactsRoot);
        Path temp = Files.createTempDirectory(artifactsRoot, TEMP_PREFIX);
        try {
            for (Map.Entry<String, byte[]> artifact : artifacts.entrySet()) {
                Files.write(temp.resolve(checkedFileName(artifact.getKey())), artifact.getValue());
            }
            return temp;
        } catch (IOException | RuntimeException e) {
            deleteRecursively(temp);
            throw e;
        }
    }

    /**
     * Move the current artifacts directory out of the way. It is deleted once
     * the new row is stored and moved back if the save fails.
     */
    private Path setAside(String operationId, Path target) throws IOException {
        if (!Files.exists(target)) {
            return null;
        }
        Path previous = artifactsRoot.resolve(PREVIOUS_PREFIX + target.getFileName() + "_" + UUID.randomUUID());
        move(target, previous);
        log.debug("Set aside previous artifacts of {} at {}", operationId, previous);
        return previous;
    }

    private void rollBack(String operationId, Path staged, Path installed, Path previous, Path target) {
        removeQuietly(operationId, staged);
        removeQuietly(operationId, installed);
        if (previous == null) {
            return;
        }
        try {
            move(previous, target);
        } catch (IOException e) {
            log.error("Failed to restore previous artifacts of {} from {}", operationId, previous, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private Map<String, byte[]> readArtifacts(Checkpoint checkpoint) {
        Path directory = Path.of(checkpoint.artifactsPath());
        if (!Files.isDirectory(directory)) {
            throw new CheckpointStorageException(
                checkpoint.operationId(), "artifacts directory missing: " + directory, null);
        }
        Map<String, byte[]> artifacts = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                artifacts.put(file.getFileName().toString(), Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new CheckpointStorageException(checkpoint.operationId(), "failed to read artifacts", e);
        }
        return artifacts;
    }

    private Path artifactsDirectory(String operationId) {
        return artifactsRoot.resolve(ARTIFACTS_PREFIX + operationId.replaceAll("[^A-Za-z0-9_.-]", "_"));
    }

    private void deleteArtifactsDirectory(String operationId) throws IOException {
        deleteRecursively(artifactsDirectory(operationId));
    }

    private void removeQuietly(String operationId, Path directory) {
        if (directory == null) {
            return;
        }
        try {
            deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Failed to roll back artifacts directory {} for {}", directory, operationId, e);
        }
    }

    private static String checkedFileName(String name) {
        Path path = Path.of(name);
        if (path.getNameCount() != 1 || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Artifact name must be a plain file name: " + name);
        }
        return name;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }
}
