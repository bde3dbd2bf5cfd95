package com.ryuqq.provisioning.testkit.fake;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.spi.AuditSink;

import java.time.Instant;
import java.util.List;

/**
 * {@link AuditSink} decorator whose appends can be switched to fail.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class FailingAuditSink implements AuditSink {

    private final AuditSink delegate;
    private volatile boolean failing;

    public FailingAuditSink(AuditSink delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public List<AuditEntry> append(List<AuditEntry> drafts) {
        if (failing) {
            throw new IllegalStateException("audit storage unavailable");
        }
        return delegate.append(drafts);
    }

    @Override
    public List<AuditEntry> findByRequest(RequestId requestId) {
        return delegate.findByRequest(requestId);
    }

    @Override
    public List<AuditEntry> findSince(Instant since) {
        return delegate.findSince(since);
    }
}
