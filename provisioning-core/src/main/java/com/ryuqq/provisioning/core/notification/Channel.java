package com.ryuqq.provisioning.core.notification;

/**
 * 알림 채널.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum Channel {
    EMAIL,
    CHAT
}
