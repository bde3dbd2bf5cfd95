package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.RequestId;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit log SPI.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Append-only: entries are never updated or deleted</li>
 *   <li>All-or-nothing: a batch is recorded entirely or not at all</li>
 *   <li>Ordering: the global {@code sequence} is strictly increasing; the per-request
 *       {@code requestSequence} starts at 1 and increases by one per entry</li>
 *   <li>Timestamps never decrease in sequence order</li>
 *   <li>Durable ack: returning normally means the entries are durable</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * Appends draft entries.
     *
     * @param drafts entries to append, in order
     * @return the recorded entries with sequences and timestamps assigned
     * @throws IllegalArgumentException if drafts is null
     * @throws RuntimeException if the entries could not be recorded durably; none were recorded
     */
    List<AuditEntry> append(List<AuditEntry> drafts);

    /**
     * Finds the entries of one request in commit order.
     *
     * @param requestId the request id
     * @return entries ordered by requestSequence
     * @throws IllegalArgumentException if requestId is null
     */
    List<AuditEntry> findByRequest(RequestId requestId);

    /**
     * Finds entries recorded at or after the given instant, in sequence order.
     *
     * @param since inclusive lower bound
     * @return matching entries
     * @throws IllegalArgumentException if since is null
     */
    List<AuditEntry> findSince(Instant since);
}
