package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.core.audit.AuditAction;
import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.spi.RequestStore;
import com.ryuqq.provisioning.core.spi.TransitionCommit;
import com.ryuqq.provisioning.core.spi.TransitionCommit.RecordWrite;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import com.ryuqq.provisioning.testkit.fake.TestClock;
import com.ryuqq.provisioning.testkit.fake.TestRequests;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Provides a {@link TestClock} and helpers for writing requests through
 * {@link RequestStore#commit(TransitionCommit)} the way the engine does.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends RequestStoreContractTest {
 *     {@literal @}Override
 *     protected AuditSink createAuditSink(Clock clock) { return new MyAuditSink(clock); }
 *
 *     {@literal @}Override
 *     protected RequestStore createStore(AuditSink auditSink) { return new MyStore(auditSink); }
 * }
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Actor REQUESTER = TestRequests.REQUESTER;
    protected static final Actor APPROVER = TestRequests.APPROVER;

    protected TestClock clock;

    @BeforeEach
    void setUpClock() {
        clock = new TestClock();
    }

    /**
     * Draft audit entry for a request.
     *
     * @param request the request
     * @param action the action
     * @return a draft entry
     */
    protected AuditEntry draft(DeploymentRequest request, AuditAction action) {
        return AuditEntry.draft(REQUESTER, action, request.getId(), request.getCatalogItemId(), Map.of());
    }

    /**
     * Inserts a new record with a REQUEST_CREATED entry.
     *
     * @param store the store
     * @param request the new record
     * @return the request
     */
    protected DeploymentRequest insert(RequestStore store, DeploymentRequest request) {
        store.commit(new TransitionCommit(
            List.of(RecordWrite.insert(request)),
            List.of(draft(request, AuditAction.REQUEST_CREATED)),
            TransitionCommit.NONE
        ));
        return request;
    }

    /**
     * Inserts a pending DEPLOY request created now.
     *
     * @param store the store
     * @param size the size parameter (nullable)
     * @return the stored request
     */
    protected DeploymentRequest insertPending(RequestStore store, String size) {
        return insert(store, TestRequests.pendingDeploy(size, clock.instant()));
    }

    /**
     * Asserts the stored status of a request.
     *
     * @param store the store
     * @param id the request id
     * @param expected the expected status
     */
    protected void assertStatus(RequestStore store, RequestId id, RequestStatus expected) {
        DeploymentRequest stored = store.find(id).orElseThrow(() -> new AssertionError("No request " + id));
        assertEquals(expected, stored.getStatus(),
            String.format("Expected status %s but was %s for %s", expected, stored.getStatus(), id));
    }

    /**
     * Asserts that the store has no record for the id.
     *
     * @param store the store
     * @param id the request id
     */
    protected void assertNotStored(RequestStore store, RequestId id) {
        assertTrue(store.find(id).isEmpty(), "Expected no record for " + id);
    }
}
