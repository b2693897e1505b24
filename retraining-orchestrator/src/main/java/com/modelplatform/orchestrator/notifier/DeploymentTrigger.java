package com.modelplatform.orchestrator.notifier;

import reactor.core.publisher.Mono;

/**
 * Remote endpoint that starts a deployment of a promoted model.
 *
 * <p>Implementations make exactly one outbound call per {@link #dispatch} subscription
 * and never retry; retry, timeout and audit are owned by {@link DeploymentNotifier}.
 */
public interface DeploymentTrigger {

    /**
     * @return {@code false} when required endpoint or credential configuration is absent
     */
    boolean isConfigured();

    /**
     * @return the HTTP status of an accepted call; a rejected call fails with
     *         {@link DeploymentTriggerException}
     */
    Mono<Integer> dispatch(DeploymentRequest request);
}
