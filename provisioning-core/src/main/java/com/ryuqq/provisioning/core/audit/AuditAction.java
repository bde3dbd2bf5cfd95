package com.ryuqq.provisioning.core.audit;

/**
 * 감사 로그 액션 (닫힌 열거형).
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum AuditAction {
    REQUEST_CREATED,
    REQUEST_APPROVED,
    REQUEST_REJECTED,
    DESTROY_REQUESTED,
    SCALE_REQUESTED,
    DEPLOYMENT_STARTED,
    DEPLOYMENT_COMPLETED,
    DEPLOYMENT_FAILED,
    RESOURCES_RELEASED,
    EXPIRATION_WARNED,
    HEALTH_RECORDED,
    APPROVAL_REMINDER_SENT
}
