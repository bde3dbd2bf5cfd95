package com.ryuqq.provisioning.core.pipeline;

/**
 * 파이프라인 트리거/폴링 실패.
 *
 * <p>엔진은 이 예외를 best-effort 실패로 취급하며 호출자에게 전파하지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
