package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.pipeline.PipelineException;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;
import com.ryuqq.provisioning.core.pipeline.PipelineStatus;
import com.ryuqq.provisioning.core.pipeline.PipelineTarget;

/**
 * Remote build/pipeline client SPI.
 *
 * <p>Implementations are thin: they do not retry and do not guarantee idempotency.
 * The engine never re-triggers on its own; a second trigger happens only through an
 * explicit operator action.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface PipelineClient {

    /**
     * Starts a pipeline run.
     *
     * @param target the pipeline target
     * @param parameters variables passed to the run
     * @return the external run link
     * @throws PipelineException if the run could not be started
     */
    PipelineRun trigger(PipelineTarget target, Parameters parameters);

    /**
     * Polls a run's status.
     *
     * @param target the pipeline target
     * @param externalId the external run id returned by {@link #trigger}
     * @return the current status
     * @throws PipelineException if the status could not be read
     */
    PipelineStatus poll(PipelineTarget target, String externalId);
}
