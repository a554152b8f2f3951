package com.openfashion.crowdfundingservice.dto.response;

import java.math.BigInteger;

public record FundingProgressResponse(
        Long campaignId,
        BigInteger totalDonations,
        BigInteger fundingGoal,
        BigInteger percent
) {}
