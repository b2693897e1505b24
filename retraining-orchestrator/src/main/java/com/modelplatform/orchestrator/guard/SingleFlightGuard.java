package com.modelplatform.orchestrator.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutually exclusive lock serialising every retraining run of this deployment.
 *
 * <p>The lock is keyed on one fixed resource name, not on the run id: there is a single
 * model identity to promote, so all runs must exclude each other. Acquisition never
 * blocks or queues; a caller that loses is rejected and may resubmit later.
 *
 * <p>{@link #release(String)} is idempotent and only frees the lock for its holder, so a
 * late release from a finished run can never free a lock taken by the next run.
 */
@Component
public class SingleFlightGuard {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightGuard.class);

    public static final String PIPELINE_RESOURCE = "retraining-pipeline";

    private final String resourceName;
    private final AtomicReference<String> holder = new AtomicReference<>();

    public SingleFlightGuard() {
        this(PIPELINE_RESOURCE);
    }

    public SingleFlightGuard(String resourceName) {
        this.resourceName = resourceName;
    }

    /**
     * @return {@code true} if {@code runId} now holds the lock
     */
    public boolean tryAcquire(String runId) {
        boolean acquired = holder.compareAndSet(null, runId);
        if (acquired) {
            log.debug("Lock acquired. resource={} runId={}", resourceName, runId);
        }
        return acquired;
    }

    /**
     * @return {@code true} if the lock was held by {@code runId} and is now free
     */
    public boolean release(String runId) {
        boolean released = holder.compareAndSet(runId, null);
        if (released) {
            log.debug("Lock released. resource={} runId={}", resourceName, runId);
        }
        return released;
    }

    public Optional<String> holder() {
        return Optional.ofNullable(holder.get());
    }
}
