/**
 * In-memory notification outbox with delayed redelivery and a dead letter queue.
 *
 * @see com.ryuqq.provisioning.core.spi.NotificationOutbox
 */
package com.ryuqq.provisioning.adapter.inmemory.outbox;
