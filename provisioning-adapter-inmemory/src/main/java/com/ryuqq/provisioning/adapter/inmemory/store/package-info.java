/**
 * In-memory persistence adapters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.adapter.inmemory.store.InMemoryRequestStore}:
 *       compare-and-set commits over a {@link java.util.concurrent.ConcurrentHashMap}</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.inmemory.store.InMemoryAuditSink}:
 *       append-only, sequenced audit log</li>
 *   <li>{@link com.ryuqq.provisioning.adapter.inmemory.store.InMemoryReminderLog}:
 *       append-only reminder history</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AuditSink auditSink = new InMemoryAuditSink(clock);
 * RequestStore store = new InMemoryRequestStore(auditSink);
 * </pre>
 *
 * @see com.ryuqq.provisioning.core.spi.RequestStore
 * @see com.ryuqq.provisioning.core.spi.AuditSink
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.inmemory.store;
