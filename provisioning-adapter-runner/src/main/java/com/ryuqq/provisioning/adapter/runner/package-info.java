/**
 * 생명주기 엔진과 백그라운드 컴포넌트 구현.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.LifecycleEngine}: 요청 상태 전이, 감사 커밋, 트리거</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.PipelineReconciler}: DEPLOYING 요청 폴링</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.NotificationWorker}: 알림 outbox 소비</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.ApprovalReminderSweeper}: 승인 대기 리마인더</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.runner.ExpirationSweeper}: 만료 임박 경고</li>
 * </ul>
 *
 * <p>스케줄링은 호출자 책임입니다. 각 컴포넌트는 한 번 호출될 때 한 배치만 처리합니다.</p>
 */
package com.ryuqq.provisioning.adapter.runner;
