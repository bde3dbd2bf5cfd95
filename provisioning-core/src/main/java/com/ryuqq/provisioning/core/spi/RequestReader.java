package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.RequestId;

import java.util.List;
import java.util.Optional;

/**
 * Read view of the request store.
 *
 * <p>Handed to a {@link TransitionCommit.Precondition} so that guards evaluated inside a commit
 * see the same snapshot the commit is applied to.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface RequestReader {

    /**
     * Finds a request by id.
     *
     * @param id the request id
     * @return the request, or empty if unknown
     * @throws IllegalArgumentException if id is null
     */
    Optional<DeploymentRequest> find(RequestId id);

    /**
     * Finds all requests whose parent is the given request, in creation order.
     * Children created at the same instant come back in insert order.
     *
     * @param parentId the lineage root id
     * @return the children (may be empty)
     * @throws IllegalArgumentException if parentId is null
     */
    List<DeploymentRequest> findChildren(RequestId parentId);
}
