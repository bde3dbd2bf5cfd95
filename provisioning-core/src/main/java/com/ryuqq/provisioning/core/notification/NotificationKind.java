package com.ryuqq.provisioning.core.notification;

/**
 * 알림 종류와 기본 채널.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum NotificationKind {

    /** 승인자에게: 새 요청 승인 필요. */
    APPROVAL_REQUESTED(Channel.EMAIL),

    /** 요청자에게: 승인됨. */
    REQUEST_APPROVED(Channel.EMAIL),

    /** 요청자에게: 반려됨. */
    REQUEST_REJECTED(Channel.EMAIL),

    DEPLOYMENT_STARTED(Channel.CHAT),

    DEPLOYMENT_COMPLETED(Channel.CHAT),

    DEPLOYMENT_FAILED(Channel.CHAT),

    /** 승인 대기 리마인더. */
    APPROVAL_REMINDER(Channel.CHAT),

    /** 요청자에게: 곧 만료됨. */
    EXPIRATION_WARNING(Channel.EMAIL);

    private final Channel defaultChannel;

    NotificationKind(Channel defaultChannel) {
        this.defaultChannel = defaultChannel;
    }

    public Channel defaultChannel() {
        return defaultChannel;
    }
}
