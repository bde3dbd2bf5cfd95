package com.ryuqq.provisioning.core.pipeline;

/**
 * 아직 시작되지 않은 실행.
 *
 * @param url 외부 빌드 URL (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record NotStarted(String url) implements PipelineStatus {
}
