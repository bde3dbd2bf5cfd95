/**
 * Notification value types.
 *
 * <p>Notifications are best effort: the engine publishes them to the outbox after a transition
 * commits, and a background worker delivers them. Delivery failure never affects request state.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.notification;
