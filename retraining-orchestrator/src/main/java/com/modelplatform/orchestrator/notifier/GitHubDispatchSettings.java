package com.modelplatform.orchestrator.notifier;

/**
 * Coordinates of the CD workflow started on promotion.
 *
 * @param token    bearer token allowed to dispatch workflows on the repository
 * @param owner    repository owner (user or organisation)
 * @param repo     repository name
 * @param workflow workflow file name, e.g. {@code cd_pipeline.yml}
 * @param ref      git ref the workflow runs on
 */
public record GitHubDispatchSettings(String token, String owner, String repo, String workflow, String ref) {

    public boolean isComplete() {
        return notBlank(token) && notBlank(owner) && notBlank(repo) && notBlank(workflow);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
