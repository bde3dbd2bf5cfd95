package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.notification.NotificationKind;
import com.ryuqq.provisioning.core.spi.NotificationOutbox;
import com.ryuqq.provisioning.core.spi.OutboxMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * {@link NotificationOutbox} contract.
 *
 * <p><strong>Verified Guarantees:</strong></p>
 * <ul>
 *   <li>Published messages are dequeued once with attempt 0</li>
 *   <li>Delayed messages are not delivered before their delay</li>
 *   <li>ack and deadLetter end delivery; retry redelivers with attempt + 1</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public abstract class NotificationOutboxContractTest extends AbstractContractTest {

    protected NotificationOutbox outbox;

    /**
     * Creates the outbox under test.
     *
     * @return a fresh, empty outbox
     */
    protected abstract NotificationOutbox createOutbox();

    @BeforeEach
    void setUpOutbox() {
        outbox = createOutbox();
    }

    @Test
    void published_message_is_dequeued_once() {
        Notification notification = notification();
        outbox.publish(notification, 0);

        List<OutboxMessage> batch = outbox.dequeue(10);

        assertEquals(1, batch.size());
        assertEquals(notification, batch.get(0).notification());
        assertEquals(0, batch.get(0).attempt());
        assertTrue(outbox.dequeue(10).isEmpty());
    }

    @Test
    void dequeue_respects_batch_size() {
        for (int i = 0; i < 5; i++) {
            outbox.publish(notification(), 0);
        }

        assertEquals(3, outbox.dequeue(3).size());
        assertEquals(2, outbox.dequeue(3).size());
    }

    @Test
    void delayed_message_is_not_delivered_early() {
        outbox.publish(notification(), 60_000);

        assertTrue(outbox.dequeue(10).isEmpty());
    }

    @Test
    void retry_redelivers_with_next_attempt() {
        outbox.publish(notification(), 0);
        OutboxMessage message = outbox.dequeue(1).get(0);

        outbox.retry(message, 0);
        List<OutboxMessage> redelivered = outbox.dequeue(1);

        assertEquals(1, redelivered.size());
        assertEquals(message.messageId(), redelivered.get(0).messageId());
        assertEquals(1, redelivered.get(0).attempt());
    }

    @Test
    void acked_and_dead_lettered_messages_are_not_redelivered() {
        outbox.publish(notification(), 0);
        outbox.publish(notification(), 0);
        List<OutboxMessage> batch = outbox.dequeue(2);

        outbox.ack(batch.get(0));
        outbox.deadLetter(batch.get(1), "gave up");

        assertTrue(outbox.dequeue(10).isEmpty());
    }

    @Test
    void publish_rejects_negative_delay() {
        assertThrows(IllegalArgumentException.class, () -> outbox.publish(notification(), -1));
    }

    private static Notification notification() {
        return Notification.of(NotificationKind.REQUEST_APPROVED, RequestId.generate(), "dev@example.com",
            Map.of("template_name", "PostgreSQL"));
    }
}
