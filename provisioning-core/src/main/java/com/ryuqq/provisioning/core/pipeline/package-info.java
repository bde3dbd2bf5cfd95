/**
 * 외부 파이프라인 연동 타입.
 *
 * <p>{@link com.ryuqq.provisioning.core.pipeline.PipelineStatus}는 sealed interface이며
 * 폴링 결과 중 {@link com.ryuqq.provisioning.core.pipeline.Finished}만 상태 전이를 일으킵니다.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.pipeline;
