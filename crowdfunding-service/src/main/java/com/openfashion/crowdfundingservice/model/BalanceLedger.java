package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "balance_ledgers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceLedger {

    @Id
    private Long campaignId;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalDonations = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger feeAccrued = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger feeCollected = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger withdrawableBalance = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalRefunded = BigInteger.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalWithdrawn = BigInteger.ZERO;

    @Version
    private Long version;

    @UpdateTimestamp
    private Instant updatedAt;

    public static BalanceLedger empty(Long campaignId) {
        return BalanceLedger.builder().campaignId(campaignId).build();
    }

    public BigInteger getFeeOutstanding() {
        return feeAccrued.subtract(feeCollected);
    }
}
