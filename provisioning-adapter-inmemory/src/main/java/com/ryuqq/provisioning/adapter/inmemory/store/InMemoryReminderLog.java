package com.ryuqq.provisioning.adapter.inmemory.store;

import com.ryuqq.provisioning.core.model.ApprovalReminder;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.spi.ReminderLog;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ReminderLog} SPI.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryReminderLog implements ReminderLog {

    private final ConcurrentHashMap<RequestId, List<ApprovalReminder>> reminders = new ConcurrentHashMap<>();

    @Override
    public void append(ApprovalReminder reminder) {
        if (reminder == null) {
            throw new IllegalArgumentException("reminder cannot be null");
        }
        reminders.computeIfAbsent(reminder.requestId(), id -> new CopyOnWriteArrayList<>()).add(reminder);
    }

    @Override
    public Optional<ApprovalReminder> latest(RequestId requestId) {
        return findByRequest(requestId).stream().max(Comparator.comparing(ApprovalReminder::sentAt));
    }

    @Override
    public List<ApprovalReminder> findByRequest(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return List.copyOf(reminders.getOrDefault(requestId, List.of()));
    }
}
