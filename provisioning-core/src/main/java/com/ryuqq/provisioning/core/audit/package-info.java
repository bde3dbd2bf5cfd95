/**
 * 감사 로그 타입.
 *
 * <p>모든 상태 전이는 커밋 시점에 정확히 하나의 {@link com.ryuqq.provisioning.core.audit.AuditEntry}를
 * 남깁니다. 감사 기록 실패는 연산 전체를 중단시키며 상태도 변경되지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.audit;
