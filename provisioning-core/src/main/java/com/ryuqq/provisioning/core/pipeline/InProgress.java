package com.ryuqq.provisioning.core.pipeline;

/**
 * 실행 중.
 *
 * @param url 외부 빌드 URL (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record InProgress(String url) implements PipelineStatus {
}
