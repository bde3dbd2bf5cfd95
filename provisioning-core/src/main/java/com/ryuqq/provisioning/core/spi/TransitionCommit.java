package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.DeploymentRequest;

import java.util.List;

/**
 * A unit of work for {@link RequestStore#commit(TransitionCommit)}.
 *
 * @param writes record writes, applied in order
 * @param auditEntries draft audit entries appended in the same unit
 * @param precondition guard re-evaluated against the store inside the unit
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record TransitionCommit(
    List<RecordWrite> writes,
    List<AuditEntry> auditEntries,
    Precondition precondition
) {

    /** Precondition that always passes. */
    public static final Precondition NONE = reader -> { };

    public TransitionCommit {
        writes = writes == null ? List.of() : List.copyOf(writes);
        auditEntries = auditEntries == null ? List.of() : List.copyOf(auditEntries);
        if (precondition == null) {
            precondition = NONE;
        }
        if (writes.isEmpty() && auditEntries.isEmpty()) {
            throw new IllegalArgumentException("commit must contain at least one write or audit entry");
        }
    }

    /**
     * Single-record update with one audit entry.
     *
     * @param before the record as read
     * @param after the new record
     * @param entry the audit entry
     * @return the commit
     */
    public static TransitionCommit update(DeploymentRequest before, DeploymentRequest after, AuditEntry entry) {
        return new TransitionCommit(List.of(RecordWrite.update(before, after)), List.of(entry), NONE);
    }

    /**
     * One record write with its compare-and-set expectation.
     *
     * @param expectedVersion version the stored record must have; 0 means the record must not exist
     * @param record the record to store
     */
    public record RecordWrite(long expectedVersion, DeploymentRequest record) {

        public RecordWrite {
            if (record == null) {
                throw new IllegalArgumentException("record cannot be null");
            }
            if (expectedVersion < 0) {
                throw new IllegalArgumentException("expectedVersion cannot be negative");
            }
        }

        public static RecordWrite insert(DeploymentRequest record) {
            return new RecordWrite(0L, record);
        }

        public static RecordWrite update(DeploymentRequest before, DeploymentRequest after) {
            if (before == null) {
                throw new IllegalArgumentException("before cannot be null");
            }
            return new RecordWrite(before.getVersion(), after);
        }
    }

    /**
     * Guard evaluated by the store inside the commit.
     */
    @FunctionalInterface
    public interface Precondition {

        /**
         * @param reader the store's view inside the unit of work
         * @throws com.ryuqq.provisioning.core.error.LifecycleException to reject the commit
         */
        void verify(RequestReader reader);
    }
}
