package com.openfashion.crowdfundingservice.dto.response;

import java.math.BigInteger;

public record FeeCollectionResult(
        String token,
        String recipient,
        BigInteger amount,
        int campaignsSwept
) {}
