package com.ryuqq.provisioning.core.model;

/**
 * 요청자 식별 정보 (생성 후 불변).
 *
 * @param email 요청자 이메일
 * @param displayName 요청자 표시 이름
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Requester(String email, String displayName) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException email 또는 displayName이 null이거나 빈 문자열인 경우
     */
    public Requester {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be null or blank");
        }
    }
}
