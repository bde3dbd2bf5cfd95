/**
 * 생명주기 연산 인터페이스.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code LifecycleEngine}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.provisioning.application.lifecycle;
