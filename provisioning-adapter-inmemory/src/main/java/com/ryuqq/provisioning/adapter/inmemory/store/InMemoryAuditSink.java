package com.ryuqq.provisioning.adapter.inmemory.store;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.spi.AuditSink;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AuditSink} SPI.
 *
 * <p><strong>Ordering:</strong></p>
 * <ul>
 *   <li>Global {@code sequence} starts at 1 and increases by one per entry</li>
 *   <li>{@code requestSequence} is counted per request id (0 for entries without a request)</li>
 *   <li>Timestamps come from the injected {@link Clock} and are clamped so they never go backwards</li>
 * </ul>
 *
 * <p>A batch is validated and sequenced in full before any entry becomes visible.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryAuditSink implements AuditSink {

    private final Clock clock;
    private final List<AuditEntry> entries;
    private final Map<RequestId, Long> requestSequences;
    private long nextSequence;
    private Instant lastTimestamp;

    /**
     * Creates a sink using the system UTC clock.
     */
    public InMemoryAuditSink() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a sink using the given clock.
     *
     * @param clock clock for entry timestamps
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryAuditSink(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.entries = new CopyOnWriteArrayList<>();
        this.requestSequences = new HashMap<>();
        this.nextSequence = 1L;
        this.lastTimestamp = Instant.EPOCH;
    }

    @Override
    public synchronized List<AuditEntry> append(List<AuditEntry> drafts) {
        if (drafts == null) {
            throw new IllegalArgumentException("drafts cannot be null");
        }
        for (AuditEntry draft : drafts) {
            if (draft == null || !draft.isDraft()) {
                throw new IllegalArgumentException("only draft entries can be appended: " + draft);
            }
        }

        Instant now = clock.instant();
        Instant timestamp = now.isBefore(lastTimestamp) ? lastTimestamp : now;

        Map<RequestId, Long> pending = new HashMap<>();
        List<AuditEntry> recorded = new ArrayList<>(drafts.size());
        long sequence = nextSequence;
        for (AuditEntry draft : drafts) {
            long requestSequence = 0L;
            RequestId requestId = draft.requestId();
            if (requestId != null) {
                long previous = pending.getOrDefault(requestId, requestSequences.getOrDefault(requestId, 0L));
                requestSequence = previous + 1;
                pending.put(requestId, requestSequence);
            }
            recorded.add(draft.withSequence(sequence++, requestSequence, timestamp));
        }

        entries.addAll(recorded);
        requestSequences.putAll(pending);
        nextSequence = sequence;
        lastTimestamp = timestamp;
        return List.copyOf(recorded);
    }

    @Override
    public List<AuditEntry> findByRequest(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return entries.stream()
            .filter(entry -> requestId.equals(entry.requestId()))
            .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        return entries.stream()
            .filter(entry -> !entry.timestamp().isBefore(since))
            .collect(Collectors.toList());
    }

    /**
     * Returns the total number of recorded entries. Used for test assertions.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }
}
