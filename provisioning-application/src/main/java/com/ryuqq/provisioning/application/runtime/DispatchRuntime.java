package com.ryuqq.provisioning.application.runtime;

/**
 * Notification dispatch runtime.
 *
 * <p>Drains the notification outbox filled by committed transitions.</p>
 *
 * <p><strong>Pump Cycle:</strong></p>
 * <pre>
 * pump()
 *   1. Dequeue a batch from the outbox
 *   2. For each message (concurrently, within the configured limit):
 *      a. Notifier.send(notification)
 *      b. success → ack
 *      c. failure → retry with exponential backoff, or dead-letter once attempts are exhausted
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>At-least-once delivery</li>
 *   <li>No request state is read or written; a delivery failure never affects a transition</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * {@literal @Scheduled}(fixedDelay = 1000)
 * public void scheduledPump() {
 *     runtime.pump();
 * }
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface DispatchRuntime {

    /**
     * Executes a single dispatch cycle.
     *
     * <p>Per-message failures are handled internally; this method returns after one batch
     * or immediately when the outbox is empty.</p>
     *
     * @return the number of messages processed in this cycle
     * @throws RuntimeException if the outbox itself is unavailable
     */
    int pump();
}
