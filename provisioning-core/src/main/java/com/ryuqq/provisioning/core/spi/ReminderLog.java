package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.model.ApprovalReminder;
import com.ryuqq.provisioning.core.model.RequestId;

import java.util.List;
import java.util.Optional;

/**
 * Append-only approval reminder log SPI.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface ReminderLog {

    /**
     * Appends a reminder.
     *
     * @param reminder the reminder
     * @throws IllegalArgumentException if reminder is null
     */
    void append(ApprovalReminder reminder);

    /**
     * Latest reminder sent for a request.
     *
     * @param requestId the request id
     * @return the latest reminder by sentAt, or empty
     */
    Optional<ApprovalReminder> latest(RequestId requestId);

    /**
     * All reminders of a request, oldest first.
     *
     * @param requestId the request id
     * @return reminders (may be empty)
     */
    List<ApprovalReminder> findByRequest(RequestId requestId);
}
