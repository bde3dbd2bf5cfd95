/**
 * 배포 요청 도메인 모델.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.model.DeploymentRequest} - Aggregate Root (불변, version 기반 CAS)</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.Decision} - 승인/반려 결정 (sealed)</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.Actor} - 연산 주체 (명시적으로 전달, 전역 상태 없음)</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.Parameters} - 순서가 보존되는 불변 파라미터</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.Lineage} - 계보 현재 크기 계산</li>
 * </ul>
 *
 * <h2>계보</h2>
 * <pre>
 * DEPLOY (root)
 *   ├─ SCALE  (parentRequestId = root)
 *   ├─ SCALE  (parentRequestId = root)
 *   └─ DESTROY (parentRequestId = root) → 완료 시 root.release 기록
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.model;
