package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.model.RequestId;

/**
 * Thrown by {@link RequestStore#commit(TransitionCommit)} when another writer committed first.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class StaleWriteException extends RuntimeException {

    private final RequestId requestId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleWriteException(RequestId requestId, long expectedVersion, long actualVersion) {
        super(String.format("Stale write on %s: expected version %d, actual %d",
            requestId == null ? null : requestId.getValue(), expectedVersion, actualVersion));
        this.requestId = requestId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public RequestId getRequestId() {
        return requestId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
