package com.ryuqq.provisioning.core.pipeline;

/**
 * 외부 파이프라인 폴링 결과.
 *
 * <ul>
 *   <li>{@link NotStarted}: 아직 대기열에 있음</li>
 *   <li>{@link InProgress}: 실행 중</li>
 *   <li>{@link Finished}: 종료됨 (성공 또는 실패)</li>
 * </ul>
 *
 * <p>{@link Finished}만 요청 상태 전이(DEPLOYING → COMPLETED/FAILED)로 이어집니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface PipelineStatus permits NotStarted, InProgress, Finished {

    /**
     * 종료된 실행인지 확인.
     *
     * @return Finished이면 true
     */
    default boolean isFinished() {
        return this instanceof Finished;
    }
}
