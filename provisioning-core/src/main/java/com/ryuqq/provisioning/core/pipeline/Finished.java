package com.ryuqq.provisioning.core.pipeline;

/**
 * 종료된 실행.
 *
 * @param succeeded 성공 여부
 * @param url 외부 빌드 URL (null 가능)
 * @param diagnostic 진단 출력 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Finished(
    boolean succeeded,
    String url,
    String diagnostic
) implements PipelineStatus {

    /**
     * 성공 결과 생성.
     *
     * @param url 외부 빌드 URL
     * @return Finished
     */
    public static Finished success(String url) {
        return new Finished(true, url, null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param url 외부 빌드 URL
     * @param diagnostic 진단 출력
     * @return Finished
     */
    public static Finished failure(String url, String diagnostic) {
        return new Finished(false, url, diagnostic);
    }
}
