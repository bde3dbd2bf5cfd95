package com.ryuqq.provisioning.core.pipeline;

/**
 * 트리거에 성공한 파이프라인 실행 링크.
 *
 * @param externalId 외부 빌드 ID
 * @param url 외부 빌드 URL (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record PipelineRun(String externalId, String url) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException externalId가 null이거나 빈 문자열인 경우
     */
    public PipelineRun {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId cannot be null or blank");
        }
    }
}
