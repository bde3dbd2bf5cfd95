package com.ryuqq.provisioning.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 알림 재발송 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=2000ms, jitterFactor=0.2):</strong></p>
 * <ul>
 *   <li>attempt=1: 2000-2400ms</li>
 *   <li>attempt=2: 4000-4800ms</li>
 *   <li>attempt=3: 8000-9600ms</li>
 * </ul>
 *
 * <p>파이프라인 트리거에는 사용하지 않습니다. 트리거 재시도는 운영자의 명시적 조작으로만 일어납니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=2000ms, maxDelay=600000ms (10분), jitterFactor=0.2</p>
     */
    public BackoffCalculator() {
        this(2000, 600000, 0.2);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수원을 지정해 생성.
     *
     * @param baseDelayMs 기본 지연 시간
     * @param maxDelayMs 최대 지연 시간
     * @param jitterFactor Jitter 비율
     * @param random [0, 1) 범위 난수원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * Jitter 없는 계산기 (결정적).
     *
     * @param baseDelayMs 기본 지연 시간
     * @param maxDelayMs 최대 지연 시간
     * @return BackoffCalculator
     */
    public static BackoffCalculator withoutJitter(long baseDelayMs, long maxDelayMs) {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, 0.0, () -> 0.0);
    }

    /**
     * 재발송 지연 시간 계산.
     *
     * @param attempt 지금까지 실패한 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // 시프트 overflow 방지
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
