package com.modelplatform.orchestrator.notifier;

import com.modelplatform.common.model.NotificationAttempt;
import com.modelplatform.common.model.NotificationOutcome;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@NoArgsConstructor
@Table("notification_attempts")
public class NotificationAttemptEntity {

    @Id
    private Long id;

    private String promotionId;

    private Integer attemptNumber;

    private LocalDateTime sentAt;

    /** {@link NotificationOutcome} name */
    private String outcome;

    private Integer httpStatus;

    public static NotificationAttemptEntity from(NotificationAttempt attempt) {
        NotificationAttemptEntity row = new NotificationAttemptEntity();
        row.setPromotionId(attempt.promotionId());
        row.setAttemptNumber(attempt.attemptNumber());
        row.setSentAt(LocalDateTime.ofInstant(attempt.sentAt(), ZoneOffset.UTC));
        row.setOutcome(attempt.outcome().name());
        row.setHttpStatus(attempt.httpStatus());
        return row;
    }

    public NotificationAttempt toAttempt() {
        return new NotificationAttempt(promotionId, attemptNumber, sentAt.toInstant(ZoneOffset.UTC),
                                       NotificationOutcome.valueOf(outcome), httpStatus);
    }
}
