package com.modelplatform.orchestrator.support;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import com.modelplatform.orchestrator.ledger.CommitResult;
import com.modelplatform.orchestrator.ledger.PromotionLedger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/** Compare-and-swap ledger held in memory, with hooks to inject storage faults. */
public class InMemoryPromotionLedger implements PromotionLedger {

    private final String registryName;
    private final List<PromotionRecord> history = new ArrayList<>();
    private PromotionRecord head = PromotionRecord.NONE;
    private final AtomicInteger commitCalls = new AtomicInteger();
    private RuntimeException commitFailure;
    private String headOverrideOnCommit;

    public InMemoryPromotionLedger(String registryName) {
        this.registryName = registryName;
    }

    /** Seeds a model of record as if a previous run had promoted it. */
    public synchronized PromotionRecord seed(double metricValue) {
        long version = head.version() + 1;
        head = new PromotionRecord(UUID.randomUUID().toString(), registryName + "-v" + version, version,
                                   "runs:/seed-" + version + "/model", metricValue, Instant.now(), "seed-run");
        history.add(head);
        return head;
    }

    public void failCommitsWith(RuntimeException failure) {
        this.commitFailure = failure;
    }

    /** Makes the next commit observe a different head, as a concurrent writer would. */
    public void moveHeadBeforeCommit(String foreignHeadId) {
        this.headOverrideOnCommit = foreignHeadId;
    }

    public int commitCalls() {
        return commitCalls.get();
    }

    public synchronized PromotionRecord head() {
        return head;
    }

    public synchronized int size() {
        return history.size();
    }

    @Override
    public synchronized Mono<PromotionRecord> readCurrent() {
        return Mono.fromCallable(this::head);
    }

    @Override
    public Mono<CommitResult> tryCommit(Candidate candidate, String expectedPriorId) {
        return Mono.fromCallable(() -> {
            commitCalls.incrementAndGet();
            if (commitFailure != null) {
                throw commitFailure;
            }
            synchronized (this) {
                String actual = headOverrideOnCommit != null ? headOverrideOnCommit : head.modelIdentifier();
                if (!actual.equals(expectedPriorId)) {
                    return new CommitResult.Conflict(expectedPriorId, actual);
                }
                long version = head.version() + 1;
                head = new PromotionRecord(UUID.randomUUID().toString(), registryName + "-v" + version,
                                           version, candidate.artifactRef(), candidate.metricValue(),
                                           Instant.now(), candidate.runId());
                history.add(head);
                return new CommitResult.Committed(head);
            }
        });
    }

    @Override
    public synchronized Flux<PromotionRecord> history() {
        List<PromotionRecord> newestFirst = new ArrayList<>(history);
        java.util.Collections.reverse(newestFirst);
        return Flux.fromIterable(newestFirst);
    }

    @Override
    public synchronized Mono<Long> historySize() {
        return Mono.just((long) history.size());
    }
}
