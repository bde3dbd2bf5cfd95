package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.notification.Notification;

/**
 * A notification held by the outbox.
 *
 * @param messageId outbox-assigned id
 * @param notification the payload
 * @param attempt delivery attempts made so far (0 before the first)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record OutboxMessage(String messageId, Notification notification, int attempt) {

    public OutboxMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId cannot be null or blank");
        }
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative");
        }
    }

    public OutboxMessage nextAttempt() {
        return new OutboxMessage(messageId, notification, attempt + 1);
    }
}
