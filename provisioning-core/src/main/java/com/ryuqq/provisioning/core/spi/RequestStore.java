package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;

import java.time.Instant;
import java.util.List;

/**
 * Persistent Storage SPI for deployment requests.
 *
 * <p>The store is the single authority for request state. Every mutation goes through
 * {@link #commit(TransitionCommit)}, which applies record writes and their audit entries
 * as one unit.</p>
 *
 * <p><strong>Commit Protocol:</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   -- 1. precondition.verify(reader)          (throws → rollback)
 *   -- 2. for each write:
 *   UPDATE requests SET ..., version = :new WHERE id = :id AND version = :expected;
 *   --    (0 rows → StaleWriteException; expected = 0 means INSERT)
 *   -- 3. auditSink.append(entries)             (throws → rollback)
 * COMMIT;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic: either every write and every audit entry is visible, or none is</li>
 *   <li>Serializable per request: two commits expecting the same version cannot both succeed</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>No external I/O inside a commit other than the audit append</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface RequestStore extends RequestReader {

    /**
     * Atomically applies a transition.
     *
     * @param commit the writes, audit entries and precondition
     * @return the audit entries as recorded by the sink (with sequences and timestamps)
     * @throws IllegalArgumentException if commit is null
     * @throws StaleWriteException if a record's version no longer matches the expected one
     * @throws com.ryuqq.provisioning.core.error.LifecycleException if the precondition rejects the commit
     * @throws RuntimeException if the store or audit sink fails; nothing is applied
     */
    List<AuditEntry> commit(TransitionCommit commit);

    /**
     * Finds requests in the given status, oldest first.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT * FROM requests
     * WHERE status = ?
     * ORDER BY created_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param status the status
     * @param limit maximum number of rows
     * @return matching requests (may be empty)
     * @throws IllegalArgumentException if status is null or limit is not positive
     */
    List<DeploymentRequest> findByStatus(RequestStatus status, int limit);

    /**
     * Finds every request created by the given requester (email match is case-insensitive).
     *
     * @param requesterEmail the requester email
     * @return matching requests, newest first
     * @throws IllegalArgumentException if requesterEmail is null or blank
     */
    List<DeploymentRequest> findByRequester(String requesterEmail);

    /**
     * Finds active deployments whose expiration is at or before the threshold
     * and whose expiration warning has not been sent yet.
     *
     * <p>Active means a COMPLETED DEPLOY request without a resource release.</p>
     *
     * @param threshold the latest expiration to include
     * @param limit maximum number of rows
     * @return matching requests, earliest expiration first
     * @throws IllegalArgumentException if threshold is null or limit is not positive
     */
    List<DeploymentRequest> findExpiring(Instant threshold, int limit);
}
