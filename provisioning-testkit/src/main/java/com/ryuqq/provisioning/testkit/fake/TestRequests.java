package com.ryuqq.provisioning.testkit.fake;

import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.CostTags;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;

import java.time.Instant;
import java.util.Map;

/**
 * Builders for requests in a given life-cycle state.
 *
 * <p>Requests are produced through the real transition methods, so their versions and
 * timestamps match what the engine would store.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class TestRequests {

    public static final String CATALOG_ITEM = "postgres-db";
    public static final Actor REQUESTER = Actor.user("dev@example.com", "Dev User");
    public static final Actor APPROVER = Actor.approver("lead@example.com", "Team Lead");

    private TestRequests() {
    }

    public static DeploymentRequest pendingDeploy(String size, Instant now) {
        return pendingDeploy(RequestId.generate(), REQUESTER, size, null, now);
    }

    public static DeploymentRequest pendingDeploy(RequestId id, Actor requester, String size, Instant expiresAt, Instant now) {
        Parameters parameters = size == null ? Parameters.empty() : Parameters.of(Map.of(Parameters.SIZE, size));
        return DeploymentRequest.newDeploy(id, CATALOG_ITEM, parameters, requester.asRequester(), CostTags.none(), expiresAt, now);
    }

    public static DeploymentRequest approved(DeploymentRequest pending, Instant now) {
        return pending.approve(APPROVER, now);
    }

    public static DeploymentRequest deploying(DeploymentRequest pending, Instant now) {
        return approved(pending, now).startDeployment(new PipelineRun("run-" + pending.getId().getValue(), null), now);
    }

    public static DeploymentRequest completed(DeploymentRequest pending, Instant now) {
        return deploying(pending, now).complete("https://ci.example.com/done", now);
    }

    public static DeploymentRequest completedDeploy(String size, Instant now) {
        return completed(pendingDeploy(size, now), now);
    }
}
