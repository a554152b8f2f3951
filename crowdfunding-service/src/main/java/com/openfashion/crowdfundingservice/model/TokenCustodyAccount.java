package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Tokens currently held in custody, one row per token contract.
 */
@Entity
@Table(name = "token_custody_accounts")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenCustodyAccount {

    @Id
    @Column(length = 42)
    private String token;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger balance = BigInteger.ZERO;

    @Version
    private Long version;

    @UpdateTimestamp
    private Instant updatedAt;

    public TokenCustodyAccount(String token) {
        this.token = token;
    }
}
