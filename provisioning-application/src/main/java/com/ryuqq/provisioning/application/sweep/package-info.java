/**
 * 주기적 스윕 인터페이스.
 *
 * @since 1.0.0
 */
package com.ryuqq.provisioning.application.sweep;
