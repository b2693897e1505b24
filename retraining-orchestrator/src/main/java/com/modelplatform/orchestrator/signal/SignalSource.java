package com.modelplatform.orchestrator.signal;

import com.modelplatform.common.model.DriftVerdict;
import com.modelplatform.common.model.QualityVerdict;
import reactor.core.publisher.Mono;

/**
 * Quality and drift verdicts for one run. Both calls may be slow and may fail; a failure
 * is fatal to the run and is signalled as {@code SignalSourceException}.
 */
public interface SignalSource {

    Mono<QualityVerdict> getQualityVerdict(String runId, String datasetRef);

    /**
     * @param currentModelRef artifact of the serving model the dataset is compared against
     */
    Mono<DriftVerdict> getDriftVerdict(String runId, String datasetRef, String currentModelRef);
}
