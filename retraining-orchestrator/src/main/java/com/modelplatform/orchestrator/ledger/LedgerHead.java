package com.modelplatform.orchestrator.ledger;

import com.modelplatform.common.model.PromotionRecord;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * The single "current model" slot of the registry. Seeded by {@code schema.sql} with the
 * {@code none} sentinel and only ever changed through
 * {@link LedgerHeadRepository#compareAndSet}.
 *
 * Column mapping (R2DBC snake_case convention):
 *   promotionId       → promotion_id
 *   modelIdentifier   → model_identifier
 *   artifactRef       → artifact_ref
 *   metricValue       → metric_value
 *   promotedAt        → promoted_at  (UTC)
 *   promotedFromRunId → promoted_from_run_id
 */
@Data
@NoArgsConstructor
@Table("model_ledger_head")
public class LedgerHead {

    @Id
    private String slot;

    private String promotionId;

    private String modelIdentifier;

    private Long version;

    private String artifactRef;

    private Double metricValue;

    private LocalDateTime promotedAt;

    private String promotedFromRunId;

    public PromotionRecord toRecord() {
        if (PromotionRecord.NONE_IDENTIFIER.equals(modelIdentifier)) {
            return PromotionRecord.NONE;
        }
        return new PromotionRecord(promotionId, modelIdentifier,
                                   version != null ? version : 0L,
                                   artifactRef, metricValue,
                                   promotedAt != null ? promotedAt.toInstant(ZoneOffset.UTC) : null,
                                   promotedFromRunId);
    }
}
