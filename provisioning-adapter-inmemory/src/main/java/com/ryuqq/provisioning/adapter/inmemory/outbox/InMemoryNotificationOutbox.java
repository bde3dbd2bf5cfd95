package com.ryuqq.provisioning.adapter.inmemory.outbox;

import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.spi.NotificationOutbox;
import com.ryuqq.provisioning.core.spi.OutboxMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link NotificationOutbox} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> DelayQueue&lt;DelayedMessage&gt; - delayed delivery ordered by availability time</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;String, InFlight&gt; - visibility timeout management</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DLQEntry&gt; - messages that exhausted their attempts</li>
 * </ul>
 *
 * <p>Delivery is at-least-once: a dequeued message that is neither acknowledged, retried
 * nor dead-lettered returns to the queue once its visibility timeout passes
 * (see {@link #processVisibilityTimeouts()}).</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * NotificationOutbox outbox = new InMemoryNotificationOutbox();
 * outbox.publish(notification, 0);
 *
 * for (OutboxMessage message : outbox.dequeue(10)) {
 *     try {
 *         notifier.send(message.notification());
 *         outbox.ack(message);
 *     } catch (RuntimeException e) {
 *         outbox.retry(message, backoff.calculate(message.attempt() + 1));
 *     }
 * }
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryNotificationOutbox implements NotificationOutbox {

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedMessage> queue;
    private final ConcurrentHashMap<String, InFlight> inFlight;
    private final List<DLQEntry> dlq;
    private final long visibilityTimeoutMs;

    /**
     * Creates an outbox with the default visibility timeout (30 seconds).
     */
    public InMemoryNotificationOutbox() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates an outbox with a custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryNotificationOutbox(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.dlq = new CopyOnWriteArrayList<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(Notification notification, long delayMs) {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedMessage(new OutboxMessage(UUID.randomUUID().toString(), notification, 0), delayMs));
    }

    @Override
    public List<OutboxMessage> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<OutboxMessage> result = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (int i = 0; i < batchSize; i++) {
            DelayedMessage delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            inFlight.put(delayed.message.messageId(), new InFlight(delayed.message, now + visibilityTimeoutMs));
            result.add(delayed.message);
        }
        return result;
    }

    @Override
    public void ack(OutboxMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        inFlight.remove(message.messageId());
    }

    @Override
    public void retry(OutboxMessage message, long delayMs) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        inFlight.remove(message.messageId());
        queue.put(new DelayedMessage(message.nextAttempt(), delayMs));
    }

    @Override
    public void deadLetter(OutboxMessage message, String reason) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        inFlight.remove(message.messageId());
        dlq.add(new DLQEntry(message, reason, System.currentTimeMillis()));
    }

    /**
     * Returns in-flight messages whose visibility timeout has expired to the queue.
     *
     * @return number of messages returned to the queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;
        for (InFlight entry : new ArrayList<>(inFlight.values())) {
            if (entry.visibilityTimeout <= now && inFlight.remove(entry.message.messageId()) != null) {
                queue.put(new DelayedMessage(entry.message, 0));
                count++;
            }
        }
        return count;
    }

    /**
     * Makes every delayed message available immediately. Used for testing retries without waiting.
     *
     * @return number of messages in the queue
     */
    public int releaseDelayed() {
        for (DelayedMessage delayed : new ArrayList<>(queue)) {
            if (queue.remove(delayed)) {
                queue.put(new DelayedMessage(delayed.message, 0));
            }
        }
        return queue.size();
    }

    /**
     * Clears queue, in-flight messages and DLQ. Used for test cleanup.
     */
    public void clear() {
        queue.clear();
        inFlight.clear();
        dlq.clear();
    }

    /**
     * Returns the number of queued messages (available or delayed, not in-flight).
     *
     * @return queue size
     */
    public int queueSize() {
        return queue.size();
    }

    /**
     * Returns the number of in-flight messages.
     *
     * @return in-flight count
     */
    public int inFlightSize() {
        return inFlight.size();
    }

    /**
     * Returns the number of messages in DLQ.
     *
     * @return DLQ size
     */
    public int dlqSize() {
        return dlq.size();
    }

    /**
     * Returns all DLQ entries.
     *
     * @return list of DLQ entries
     */
    public List<DLQEntry> getDLQEntries() {
        return new ArrayList<>(dlq);
    }

    private static class DelayedMessage implements Delayed {
        private final OutboxMessage message;
        private final long availableAt;

        DelayedMessage(OutboxMessage message, long delayMs) {
            this.message = message;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static class InFlight {
        private final OutboxMessage message;
        private final long visibilityTimeout;

        InFlight(OutboxMessage message, long visibilityTimeout) {
            this.message = message;
            this.visibilityTimeout = visibilityTimeout;
        }
    }

    /**
     * Dead Letter Queue entry.
     */
    public static class DLQEntry {
        private final OutboxMessage message;
        private final String reason;
        private final long timestamp;

        DLQEntry(OutboxMessage message, String reason, long timestamp) {
            this.message = message;
            this.reason = reason;
            this.timestamp = timestamp;
        }

        public OutboxMessage getMessage() {
            return message;
        }

        public String getReason() {
            return reason;
        }

        public long getTimestamp() {
            return timestamp;
        }
    }
}
