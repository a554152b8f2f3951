package com.openfashion.crowdfundingservice.dto.response;

import java.math.BigInteger;
import java.util.Map;

public record PlatformOverviewResponse(
        long latestCampaignId,
        int platformFeeRateBps,
        boolean paused,
        Map<String, BigInteger> collectedFeesByToken
) {}
