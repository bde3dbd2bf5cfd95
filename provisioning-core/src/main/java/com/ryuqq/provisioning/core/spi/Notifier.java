package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.notification.Notification;

/**
 * Email/chat delivery SPI.
 *
 * <p>Fire-and-forget from the engine's point of view. Implementations throw on failure so
 * the dispatcher can retry; the failure never reaches request state.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface Notifier {

    /**
     * Delivers a notification.
     *
     * @param notification the notification
     * @throws RuntimeException if delivery failed
     */
    void send(Notification notification);
}
