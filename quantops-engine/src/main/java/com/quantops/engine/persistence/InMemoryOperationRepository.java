package com.quantops.engine.persistence;

import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.OptimisticLockException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.repository.OperationFilter;
import com.quantops.core.repository.OperationRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of OperationRepository.
 * Used by workers for their local registry and by tests.
 */
public class InMemoryOperationRepository implements OperationRepository {

    private static final Comparator<Operation> NEWEST_FIRST =
        Comparator.comparing(Operation::createdAt).thenComparing(Operation::operationId).reversed();

    private static final Comparator<Operation> OLDEST_FIRST =
        Comparator.comparing(Operation::createdAt).thenComparing(Operation::operationId);

    private final Map<String, Operation> operations = new ConcurrentHashMap<>();

    @Override
    public void save(Operation operation) {
        Operation existing = operations.putIfAbsent(operation.operationId(), operation);
        if (existing != null) {
            throw new OperationConflictException("Operation already exists: " + operation.operationId());
        }
    }

    @Override
    public void update(Operation operation) {
        long[] actual = {-1};
        Operation stored = operations.computeIfPresent(operation.operationId(), (id, current) -> {
            if (current.version() != operation.version() - 1) {
                actual[0] = current.version();
                return current;
            }
            return operation;
        });
        if (stored == null) {
            throw new OptimisticLockException("Operation", operation.operationId());
        }
        if (stored != operation) {
            throw new OptimisticLockException(
                "Operation", operation.operationId(), operation.version() - 1, actual[0]);
        }
    }

    @Override
    public Optional<Operation> findById(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    @Override
    public List<Operation> find(OperationFilter filter) {
        return operations.values().stream()
            .filter(filter::matches)
            .sorted(NEWEST_FIRST)
            .skip(filter.offset())
            .limit(filter.limit())
            .collect(Collectors.toList());
    }

    @Override
    public long count(OperationFilter filter) {
        return operations.values().stream().filter(filter::matches).count();
    }

    @Override
    public long countActive() {
        return operations.values().stream().filter(o -> o.status().isActive()).count();
    }

    @Override
    public List<Operation> findByParent(String parentOperationId) {
        return operations.values().stream()
            .filter(o -> parentOperationId.equals(o.parentOperationId()))
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<Operation> findByStatus(OperationStatus status, int limit) {
        return operations.values().stream()
            .filter(o -> o.status() == status)
            .sorted(OLDEST_FIRST)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<OperationStatus, Long> countByStatus() {
        Map<OperationStatus, Long> counts = new EnumMap<>(OperationStatus.class);
        operations.values().forEach(o -> counts.merge(o.status(), 1L, Long::sum));
        return counts;
    }

    @Override
    public boolean tryResume(String operationId, Instant resumedAt) {
        boolean[] won = {false};
        operations.computeIfPresent(operationId, (id, current) -> {
            if (!current.status().isResumable()) {
                return current;
            }
            won[0] = true;
            return current.toBuilder()
                .status(OperationStatus.RESUMING)
                .errorMessage(null)
                .resultSummary(null)
                .startedAt(resumedAt)
                .completedAt(null)
                .incrementVersion()
                .build();
        });
        return won[0];
    }

    @Override
    public List<Operation> findFinishedBefore(Instant completedBefore, int limit) {
        return operations.values().stream()
            .filter(o -> o.status().isTerminal())
            .filter(o -> o.completedAt() != null && o.completedAt().isBefore(completedBefore))
            .sorted(Comparator.comparing(Operation::completedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String operationId) {
        return operations.remove(operationId) != null;
    }
}
