package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Data
@Builder
@Table(name = "outbox_events", indexes = {
        @Index(name = "idx_outbox_status_created", columnList = "status, created_at")
})
@AllArgsConstructor
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Campaign id, or the token address for platform-wide events
    @Column(nullable = false)
    private String aggregateId;

    @Column(nullable = false, length = 40)
    @Enumerated(EnumType.STRING)
    private CampaignEventType eventType;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OutboxStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 500)
    private String lastError;

    public void recordFailure(String error, int maxAttempts) {
        attempts++;
        lastError = error == null || error.length() <= 500 ? error : error.substring(0, 500);
        if (attempts >= maxAttempts) {
            status = OutboxStatus.FAILED;
        }
    }
}
