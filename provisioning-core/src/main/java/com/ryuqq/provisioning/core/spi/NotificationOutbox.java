package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.notification.Notification;

import java.util.List;

/**
 * Outbox SPI between committed transitions and notification delivery.
 *
 * <p>The engine publishes after a commit; the notification worker dequeues, delivers,
 * then acknowledges, retries with a delay, or dead-letters.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Dequeued messages are invisible to other consumers until ack/retry/deadLetter</li>
 *   <li>At-least-once delivery</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface NotificationOutbox {

    /**
     * Publishes a notification.
     *
     * @param notification the notification
     * @param delayMs delay before it becomes visible (0 for immediate)
     * @throws IllegalArgumentException if notification is null or delayMs is negative
     */
    void publish(Notification notification, long delayMs);

    /**
     * Dequeues up to {@code batchSize} visible messages.
     *
     * @param batchSize maximum number of messages
     * @return dequeued messages (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<OutboxMessage> dequeue(int batchSize);

    /**
     * Removes a delivered message.
     *
     * @param message the message
     * @throws IllegalArgumentException if message is null
     */
    void ack(OutboxMessage message);

    /**
     * Returns a message to the queue with its attempt counter incremented.
     *
     * @param message the message
     * @param delayMs delay before it becomes visible again
     * @throws IllegalArgumentException if message is null or delayMs is negative
     */
    void retry(OutboxMessage message, long delayMs);

    /**
     * Moves a message to the dead-letter queue.
     *
     * @param message the message
     * @param reason the last failure
     * @throws IllegalArgumentException if message or reason is null
     */
    void deadLetter(OutboxMessage message, String reason);
}
