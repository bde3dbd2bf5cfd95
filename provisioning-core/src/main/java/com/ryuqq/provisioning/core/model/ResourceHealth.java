package com.ryuqq.provisioning.core.model;

/**
 * 배포된 리소스의 헬스 상태.
 *
 * <p>외부 헬스 체크 협력자만 변경하며, 승인/트리거 로직은 건드리지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum ResourceHealth {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
