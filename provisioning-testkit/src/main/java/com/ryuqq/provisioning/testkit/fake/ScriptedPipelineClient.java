package com.ryuqq.provisioning.testkit.fake;

import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.pipeline.InProgress;
import com.ryuqq.provisioning.core.pipeline.PipelineException;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;
import com.ryuqq.provisioning.core.pipeline.PipelineStatus;
import com.ryuqq.provisioning.core.pipeline.PipelineTarget;
import com.ryuqq.provisioning.core.spi.PipelineClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link PipelineClient} fake with scriptable failures and run statuses.
 *
 * <p>Triggers succeed by default and return run ids {@code run-1}, {@code run-2}, ...
 * Polls return {@link InProgress} unless a status was scripted with {@link #finish}.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ScriptedPipelineClient implements PipelineClient {

    private final AtomicInteger runCounter = new AtomicInteger();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final List<Trigger> triggers = new CopyOnWriteArrayList<>();
    private final Map<String, PipelineStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Makes the next {@code count} triggers throw {@link PipelineException}.
     *
     * @param count number of failing triggers
     * @return this
     */
    public ScriptedPipelineClient failNextTriggers(int count) {
        failuresRemaining.set(count);
        return this;
    }

    /**
     * Scripts the status returned for a run.
     *
     * @param externalId the run id
     * @param status the status to return from poll
     * @return this
     */
    public ScriptedPipelineClient finish(String externalId, PipelineStatus status) {
        statuses.put(externalId, status);
        return this;
    }

    @Override
    public PipelineRun trigger(PipelineTarget target, Parameters parameters) {
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new PipelineException("Pipeline service unavailable");
        }
        String externalId = "run-" + runCounter.incrementAndGet();
        triggers.add(new Trigger(target, parameters, externalId));
        return new PipelineRun(externalId, "https://ci.example.com/" + target.project() + "/pipelines/" + externalId);
    }

    @Override
    public PipelineStatus poll(PipelineTarget target, String externalId) {
        return statuses.getOrDefault(externalId, new InProgress("https://ci.example.com/pipelines/" + externalId));
    }

    /**
     * Successful triggers, in order.
     *
     * @return recorded triggers
     */
    public List<Trigger> triggers() {
        return List.copyOf(triggers);
    }

    /**
     * One successful trigger call.
     *
     * @param target the target
     * @param parameters the parameters as passed by the caller
     * @param externalId the returned run id
     */
    public record Trigger(PipelineTarget target, Parameters parameters, String externalId) {
    }
}
