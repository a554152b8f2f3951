package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "campaigns", indexes = {
        @Index(name = "idx_campaigns_creator", columnList = "creator"),
        @Index(name = "idx_campaigns_token", columnList = "token")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    // Allocated from PlatformSettings.latestCampaignId, never generated by the database
    @Id
    private Long id;

    @Column(nullable = false, updatable = false, length = 42)
    private String creator;

    // Copy of the global rate at creation; later rate changes never reach existing campaigns
    @Column(nullable = false, updatable = false)
    private int platformFeeRateBps;

    @Column(nullable = false)
    private boolean disputed;

    @Column(nullable = false, updatable = false)
    private Instant startTime;

    @Column(nullable = false)
    private Instant endTime;

    @Column(nullable = false)
    private String name;

    @Column(length = 4000)
    private String description;

    private String url;

    private String imageUrl;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger fundingGoal;

    @Column(nullable = false, updatable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private FundingModel fundingModel;

    @Column(nullable = false, updatable = false, length = 42)
    private String token;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private CampaignStatus status;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean isCreator(String address) {
        return creator.equalsIgnoreCase(address);
    }
}
