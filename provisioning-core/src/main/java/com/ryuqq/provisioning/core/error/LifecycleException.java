package com.ryuqq.provisioning.core.error;

/**
 * 생명주기 연산 실패.
 *
 * <p>가드 위반, 미존재, 권한 없음, 영속화 실패를 하나의 예외 타입으로 표현하며,
 * {@link #getErrorCode()}와 {@link #getKind()}로 구분합니다.</p>
 *
 * <p>GUARD_VIOLATION, NOT_FOUND, FORBIDDEN은 어떤 변경도 일어나기 전에 던져집니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class LifecycleException extends RuntimeException {

    private final ErrorCode errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public LifecycleException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public LifecycleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorKind getKind() {
        return errorCode.kind();
    }

    /**
     * 가드 위반인지 확인.
     *
     * @return GUARD_VIOLATION이면 true
     */
    public boolean isGuardViolation() {
        return getKind() == ErrorKind.GUARD_VIOLATION;
    }
}
