package com.ryuqq.provisioning.core.error;

/**
 * 오류 분류.
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>GUARD_VIOLATION, NOT_FOUND, FORBIDDEN: 호출자에게 동기적으로 반환, 변경 없음</li>
 *   <li>DURABILITY_FAILURE: 연산 전체 중단, 호출자가 전체를 재시도</li>
 * </ul>
 *
 * <p>파이프라인 트리거/알림 실패(best-effort)는 엔진 경계를 넘지 않으므로 여기에 없습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum ErrorKind {
    GUARD_VIOLATION,
    NOT_FOUND,
    FORBIDDEN,
    DURABILITY_FAILURE
}
