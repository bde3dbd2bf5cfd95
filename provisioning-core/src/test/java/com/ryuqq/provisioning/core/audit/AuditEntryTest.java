package com.ryuqq.provisioning.core.audit;

import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.Provenance;
import com.ryuqq.provisioning.core.model.RequestId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditEntryTest {

    @Test
    void draft_CarriesActorAndProvenance() {
        Provenance provenance = Provenance.fromHeaders("10.0.0.1, 10.0.0.2", "10.0.0.3", "curl/8.0");
        Actor actor = Actor.approver("lead@example.com", "Team Lead").from(provenance);

        AuditEntry draft = AuditEntry.draft(actor, AuditAction.REQUEST_APPROVED, RequestId.of("req-1"), "postgres-db", null);

        assertTrue(draft.isDraft());
        assertNull(draft.timestamp());
        assertEquals("lead@example.com", draft.actorEmail());
        assertEquals(provenance, draft.provenance());
        assertEquals("10.0.0.1", draft.provenance().clientAddress());
        assertTrue(draft.details().isEmpty());
    }

    @Test
    void details_AreOrderedAndImmutable() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("previous_size", "small");
        details.put("new_size", "large");

        AuditEntry entry = AuditEntry.draft(Actor.system("scheduler"), AuditAction.SCALE_REQUESTED, RequestId.of("req-1"), "postgres-db", details);
        details.put("extra", "x");

        assertEquals(List.of("previous_size", "new_size"), List.copyOf(entry.details().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> entry.details().put("a", "b"));
    }

    @Test
    void withSequence_AssignsOrderingFields() {
        Instant now = Instant.parse("2024-01-01T09:00:00Z");
        AuditEntry recorded = AuditEntry.draft(Actor.system("pipeline"), AuditAction.DEPLOYMENT_COMPLETED, RequestId.of("req-1"), "postgres-db", Map.of())
            .withSequence(7L, 3L, now);

        assertFalse(recorded.isDraft());
        assertEquals(7L, recorded.sequence());
        assertEquals(3L, recorded.requestSequence());
        assertEquals(now, recorded.timestamp());
        assertEquals("pipeline@system.local", recorded.actorEmail());
    }
}
