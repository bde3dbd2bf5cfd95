/**
 * 생명주기 연산 오류 모델 ({@link com.ryuqq.provisioning.core.error.LifecycleException}).
 */
package com.ryuqq.provisioning.core.error;
