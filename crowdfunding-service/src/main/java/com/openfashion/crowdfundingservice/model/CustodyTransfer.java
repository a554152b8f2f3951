package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "custody_transfers", indexes = {
        @Index(name = "idx_custody_transfers_token", columnList = "token"),
        @Index(name = "idx_custody_transfers_counterparty", columnList = "counterparty")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustodyTransfer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 42)
    private String token;

    @Column(nullable = false, length = 42)
    private String counterparty;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TransferDirection direction;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
