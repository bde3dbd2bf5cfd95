/**
 * 승인 리마인더 정책.
 */
package com.ryuqq.provisioning.core.reminder;
