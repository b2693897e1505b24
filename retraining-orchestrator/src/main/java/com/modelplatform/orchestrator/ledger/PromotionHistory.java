package com.modelplatform.orchestrator.ledger;

import com.modelplatform.common.model.PromotionRecord;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Append-only history row, one per committed promotion. Rows are inserted in the same
 * transaction that moves the ledger head and are never updated.
 */
@Data
@NoArgsConstructor
@Table("promotion_history")
public class PromotionHistory {

    @Id
    private Long id;

    private String promotionId;

    private String modelIdentifier;

    private Long version;

    private String artifactRef;

    private Double metricValue;

    private LocalDateTime promotedAt;

    private String promotedFromRunId;

    public static PromotionHistory from(PromotionRecord record) {
        PromotionHistory row = new PromotionHistory();
        row.setPromotionId(record.promotionId());
        row.setModelIdentifier(record.modelIdentifier());
        row.setVersion(record.version());
        row.setArtifactRef(record.artifactRef());
        row.setMetricValue(record.metricValue());
        row.setPromotedAt(LocalDateTime.ofInstant(record.promotedAt(), ZoneOffset.UTC));
        row.setPromotedFromRunId(record.promotedFromRunId());
        return row;
    }

    public PromotionRecord toRecord() {
        return new PromotionRecord(promotionId, modelIdentifier, version, artifactRef, metricValue,
                                   promotedAt.toInstant(ZoneOffset.UTC), promotedFromRunId);
    }
}
