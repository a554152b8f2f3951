package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "donor_records", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"donor", "campaign_id"})
}, indexes = {
        @Index(name = "idx_donor_records_campaign_id", columnList = "campaign_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DonorRecord {

    // Identity order doubles as first-donation order for both donor indexes
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 42)
    private String donor;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private Long campaignId;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalDonated = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger refundClaimed = BigInteger.ZERO;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant firstDonationAt;
}
