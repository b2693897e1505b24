package com.modelplatform.orchestrator.store;

import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.RunDecision;
import com.modelplatform.common.model.RunError;
import com.modelplatform.common.model.RunOutcome;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persisted {@link RunOutcome}. {@code run_id} carries a unique constraint; the
 * surrogate {@code id} only exists so inserts go through the repository.
 */
@Data
@NoArgsConstructor
@Table("run_outcomes")
public class RunOutcomeEntity {

    @Id
    private Long id;

    private String runId;

    /** {@link RunDecision} name */
    private String decision;

    /** {@link ErrorCode} name, null unless the run failed */
    private String errorCode;

    private String errorMessage;

    private LocalDateTime completedAt;

    private String promotionId;

    private Double candidateMetric;

    public static RunOutcomeEntity from(RunOutcome outcome) {
        RunOutcomeEntity row = new RunOutcomeEntity();
        row.setRunId(outcome.runId());
        row.setDecision(outcome.decision().name());
        if (outcome.error() != null) {
            row.setErrorCode(outcome.error().code().name());
            row.setErrorMessage(outcome.error().message());
        }
        row.setCompletedAt(LocalDateTime.ofInstant(outcome.completedAt(), ZoneOffset.UTC));
        row.setPromotionId(outcome.promotionId());
        row.setCandidateMetric(outcome.candidateMetric());
        return row;
    }

    public RunOutcome toOutcome() {
        RunError error = errorCode == null ? null : new RunError(ErrorCode.valueOf(errorCode), errorMessage);
        return new RunOutcome(runId, RunDecision.valueOf(decision), error,
                              completedAt.toInstant(ZoneOffset.UTC), promotionId, candidateMetric);
    }
}
