package com.modelplatform.orchestrator.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps active run ids to their {@link CancellationToken} so that an operator abort
 * arriving over HTTP can reach the run's suspend points.
 */
@Component
public class RunCancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunCancellationRegistry.class);

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String runId) {
        CancellationToken token = new CancellationToken(runId);
        tokens.put(runId, token);
        return token;
    }

    /**
     * @return {@code false} if no active run has this id
     */
    public boolean cancel(String runId) {
        CancellationToken token = tokens.get(runId);
        if (token == null) {
            return false;
        }
        boolean fired = token.cancel();
        log.warn("Cancellation requested. runId={} firstRequest={}", runId, fired);
        return true;
    }

    public void unregister(String runId, CancellationToken token) {
        tokens.remove(runId, token);
    }
}
