package com.ryuqq.provisioning.core.notification;

import com.ryuqq.provisioning.core.model.RequestId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 발송할 알림.
 *
 * <p>템플릿 렌더링은 Notifier 구현의 책임이며, 여기에는 렌더링에 필요한 사실(facts)만 담습니다.</p>
 *
 * @param kind 알림 종류
 * @param channel 채널
 * @param requestId 관련 요청 (null 가능)
 * @param recipient 수신자 (이메일 주소 또는 채널명, null이면 채널 기본값)
 * @param facts 렌더링용 값 (순서 보존, 불변)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Notification(
    NotificationKind kind,
    Channel channel,
    RequestId requestId,
    String recipient,
    Map<String, String> facts
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 channel이 null인 경우
     */
    public Notification {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        facts = facts == null || facts.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
    }

    /**
     * 기본 채널로 알림 생성.
     *
     * @param kind 알림 종류
     * @param requestId 관련 요청
     * @param recipient 수신자
     * @param facts 렌더링용 값
     * @return Notification
     */
    public static Notification of(
        NotificationKind kind,
        RequestId requestId,
        String recipient,
        Map<String, String> facts
    ) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return new Notification(kind, kind.defaultChannel(), requestId, recipient, facts);
    }
}
