package com.ryuqq.provisioning.adapter.inmemory.store;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.spi.AuditSink;
import com.ryuqq.provisioning.core.spi.RequestStore;
import com.ryuqq.provisioning.core.spi.StaleWriteException;
import com.ryuqq.provisioning.core.spi.TransitionCommit;
import com.ryuqq.provisioning.core.spi.TransitionCommit.RecordWrite;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RequestStore} SPI for testing and reference purposes.
 *
 * <p><strong>Commit Simulation:</strong></p>
 * <ul>
 *   <li>{@link #commit(TransitionCommit)} is {@code synchronized}; commits are serialized</li>
 *   <li>Every check (precondition, versions) runs before anything is written</li>
 *   <li>The audit append runs before the records are stored, so an audit failure leaves no trace</li>
 * </ul>
 *
 * <p>Reads go straight to a {@link ConcurrentHashMap} and never block on a commit.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Queries scan every record (no indexes)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryRequestStore implements RequestStore {

    private final ConcurrentHashMap<RequestId, DeploymentRequest> records;
    // first-insert sequence; breaks createdAt ties so creation order is stable
    private final ConcurrentHashMap<RequestId, Long> insertionOrder;
    private final AtomicLong sequence;
    private final Comparator<DeploymentRequest> oldestFirst;
    private final AuditSink auditSink;

    /**
     * Creates a store that appends audit entries to the given sink.
     *
     * @param auditSink the audit sink written inside each commit
     * @throws IllegalArgumentException if auditSink is null
     */
    public InMemoryRequestStore(AuditSink auditSink) {
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        this.records = new ConcurrentHashMap<>();
        this.insertionOrder = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
        this.oldestFirst = Comparator.comparing(DeploymentRequest::getCreatedAt)
            .thenComparing(request -> insertionOrder.getOrDefault(request.getId(), Long.MAX_VALUE));
        this.auditSink = auditSink;
    }

    @Override
    public synchronized List<AuditEntry> commit(TransitionCommit commit) {
        if (commit == null) {
            throw new IllegalArgumentException("commit cannot be null");
        }

        // 1. precondition
        commit.precondition().verify(this);

        // 2. compare-and-set check for every write
        for (RecordWrite write : commit.writes()) {
            RequestId id = write.record().getId();
            DeploymentRequest stored = records.get(id);
            long actualVersion = stored == null ? 0L : stored.getVersion();
            if (actualVersion != write.expectedVersion()) {
                throw new StaleWriteException(id, write.expectedVersion(), actualVersion);
            }
        }

        // 3. audit append (all-or-nothing)
        List<AuditEntry> recorded = commit.auditEntries().isEmpty()
            ? List.of()
            : auditSink.append(commit.auditEntries());

        // 4. apply
        for (RecordWrite write : commit.writes()) {
            RequestId id = write.record().getId();
            insertionOrder.computeIfAbsent(id, ignored -> sequence.incrementAndGet());
            records.put(id, write.record());
        }
        return recorded;
    }

    @Override
    public Optional<DeploymentRequest> find(RequestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<DeploymentRequest> findChildren(RequestId parentId) {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        return records.values().stream()
            .filter(request -> request.getParentRequestId().map(parentId::equals).orElse(false))
            .sorted(oldestFirst)
            .collect(Collectors.toList());
    }

    @Override
    public List<DeploymentRequest> findByStatus(RequestStatus status, int limit) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return records.values().stream()
            .filter(request -> request.getStatus() == status)
            .sorted(oldestFirst)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<DeploymentRequest> findByRequester(String requesterEmail) {
        if (requesterEmail == null || requesterEmail.isBlank()) {
            throw new IllegalArgumentException("requesterEmail cannot be null or blank");
        }
        return records.values().stream()
            .filter(request -> request.getRequester().email().equalsIgnoreCase(requesterEmail))
            .sorted(oldestFirst.reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<DeploymentRequest> findExpiring(Instant threshold, int limit) {
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        return records.values().stream()
            .filter(DeploymentRequest::isActiveDeployment)
            .filter(request -> !request.isExpirationWarningSent())
            .filter(request -> request.getExpiresAt().map(expiresAt -> !expiresAt.isAfter(threshold)).orElse(false))
            .sorted(Comparator.comparing((DeploymentRequest request) -> request.getExpiresAt().orElseThrow())
                .thenComparing(request -> request.getId().getValue()))
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * Returns the number of stored records. Used for test assertions.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public synchronized void clear() {
        records.clear();
        insertionOrder.clear();
    }
}
