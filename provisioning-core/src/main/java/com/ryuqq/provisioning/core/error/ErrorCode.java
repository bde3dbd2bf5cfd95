package com.ryuqq.provisioning.core.error;

/**
 * 생명주기 연산 오류 코드.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /** 현재 상태에서 허용되지 않는 전이. */
    INVALID_STATE("LC-409", ErrorKind.GUARD_VIOLATION),

    /** 반려 사유 누락. */
    EMPTY_REASON("LC-400", ErrorKind.GUARD_VIOLATION),

    /** 부모가 완료된 DEPLOY 요청이 아님. */
    NOT_COMPLETED_DEPLOY("LC-422", ErrorKind.GUARD_VIOLATION),

    /** 현재 크기와 같은 크기로의 SCALE. */
    SAME_SIZE("LC-423", ErrorKind.GUARD_VIOLATION),

    /** COMPLETED 상태가 아닌 요청에 대한 헬스 기록. */
    NOT_COMPLETED("LC-424", ErrorKind.GUARD_VIOLATION),

    /** 같은 부모에 진행 중인 DESTROY/SCALE이 이미 있음. */
    DERIVATIVE_PENDING("LC-425", ErrorKind.GUARD_VIOLATION),

    /** 요청 종류와 부모 참조 조합이 잘못됨. */
    INVALID_LINEAGE("LC-426", ErrorKind.GUARD_VIOLATION),

    /** 필수 파라미터 누락. */
    MISSING_PARAMETER("LC-427", ErrorKind.GUARD_VIOLATION),

    /** 존재하지 않는 요청. */
    NOT_FOUND("LC-404", ErrorKind.NOT_FOUND),

    /** 권한 없음. */
    FORBIDDEN("LC-403", ErrorKind.FORBIDDEN),

    /** 상태 또는 감사 로그 저장 실패. */
    DURABILITY_FAILURE("LC-500", ErrorKind.DURABILITY_FAILURE);

    private final String code;
    private final ErrorKind kind;

    ErrorCode(String code, ErrorKind kind) {
        this.code = code;
        this.kind = kind;
    }

    /**
     * 외부 노출용 코드 (예: LC-409).
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    /**
     * 오류 분류.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return kind;
    }
}
