package com.ryuqq.provisioning.testkit.fake;

import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.notification.NotificationKind;
import com.ryuqq.provisioning.core.spi.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link Notifier} fake that records deliveries and can fail on demand.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class RecordingNotifier implements Notifier {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger attempts = new AtomicInteger();

    /**
     * Makes the next {@code count} sends throw.
     *
     * @param count number of failing sends
     * @return this
     */
    public RecordingNotifier failNext(int count) {
        failuresRemaining.set(count);
        return this;
    }

    @Override
    public void send(Notification notification) {
        attempts.incrementAndGet();
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("SMTP connection refused");
        }
        sent.add(notification);
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }

    public List<Notification> sent(NotificationKind kind) {
        return sent.stream().filter(n -> n.kind() == kind).collect(Collectors.toList());
    }

    public int attempts() {
        return attempts.get();
    }
}
