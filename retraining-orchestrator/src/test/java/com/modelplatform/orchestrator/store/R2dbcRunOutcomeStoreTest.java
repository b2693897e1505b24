package com.modelplatform.orchestrator.store;

import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.RunDecision;
import com.modelplatform.common.model.RunError;
import com.modelplatform.common.model.RunOutcome;
import com.modelplatform.common.model.RunRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

@DataR2dbcTest
class R2dbcRunOutcomeStoreTest {

    @Autowired
    private RunOutcomeRepository repository;

    private R2dbcRunOutcomeStore store;

    @BeforeEach
    void setUp() {
        repository.deleteAll().block();
        store = new R2dbcRunOutcomeStore(repository);
    }

    @Test
    @DisplayName("failed outcome keeps its sanitised error and candidate metric")
    void failedOutcome() {
        Instant completedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        RunOutcome outcome = new RunOutcome("run-1", RunDecision.FAILED,
            new RunError(ErrorCode.LEDGER_CONFLICT, "Promotion ledger head changed during evaluation"),
            completedAt, null, 0.84);

        store.save(outcome).block();

        StepVerifier.create(store.find("run-1"))
            .assertNext(found -> assertEquals(outcome, found))
            .verifyComplete();
    }

    @Test
    @DisplayName("run id of the maximum accepted length is stored and found")
    void longRunId() {
        String runId = "r".repeat(RunRequest.MAX_RUN_ID_LENGTH);

        store.save(RunOutcome.skipped(runId)).block();

        StepVerifier.create(store.find(runId))
            .assertNext(found -> assertEquals(RunDecision.SKIPPED, found.decision()))
            .verifyComplete();
    }

    @Test
    @DisplayName("unknown run id → empty")
    void unknownRun() {
        StepVerifier.create(store.find("missing")).verifyComplete();
    }

    @Test
    @DisplayName("second outcome for the same run id is refused")
    void writeOnce() {
        store.save(RunOutcome.skipped("run-2")).block();

        StepVerifier.create(store.save(RunOutcome.skipped("run-2")))
            .expectError()
            .verify();
    }
}
