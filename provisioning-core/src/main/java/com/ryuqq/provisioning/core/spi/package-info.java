/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.spi.RequestStore} - Request persistence with atomic compare-and-set commits</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.AuditSink} - Append-only audit log</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.PipelineClient} - Remote pipeline trigger/poll</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.NotificationOutbox} - Post-commit notification queue</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.Notifier} - Email/chat delivery</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.CatalogLookup} - Template catalog</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.ReminderLog} - Approval reminder history</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Pluggability:</strong> In-memory implementations for tests, persistent ones in production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.spi;
