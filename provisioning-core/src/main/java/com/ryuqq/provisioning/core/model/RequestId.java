package com.ryuqq.provisioning.core.model;

import java.util.UUID;

/**
 * 배포 요청의 전역 고유 식별자.
 *
 * <p>RequestId는 요청 생성 시점에 발급되며, 감사 로그와 파이프라인 연계,
 * 리니지(부모 요청 참조)에서 요청을 가리키는 데 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class RequestId {

    private static final int MAX_LENGTH = 64;

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RequestId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RequestId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 RequestId 생성.
     *
     * @param value RequestId 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 새 RequestId 발급 (UUID 기반).
     *
     * @return 새 RequestId
     */
    public static RequestId generate() {
        return new RequestId(UUID.randomUUID().toString());
    }

    /**
     * RequestId 값 조회.
     *
     * @return RequestId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId that = (RequestId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
