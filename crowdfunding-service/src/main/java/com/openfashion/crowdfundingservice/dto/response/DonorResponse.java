package com.openfashion.crowdfundingservice.dto.response;

import java.math.BigInteger;

public record DonorResponse(
        Long campaignId,
        String donor,
        BigInteger totalDonated,
        BigInteger refundClaimed,
        BigInteger refundableRemaining
) {}
