package com.openfashion.crowdfundingservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Entity
@Table(name = "collected_fee_totals")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectedFeeTotal {

    @Id
    @Column(length = 42)
    private String token;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalCollected = BigInteger.ZERO;

    @Version
    private Long version;

    public CollectedFeeTotal(String token) {
        this.token = token;
    }
}
