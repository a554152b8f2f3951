package com.openfashion.crowdfundingservice.dto.response;

import com.openfashion.crowdfundingservice.model.CampaignStatus;

import java.math.BigInteger;

public record CampaignInfoResponse(
        CampaignResponse campaign,
        BalanceResponse balance,
        BigInteger progressPercent,
        CampaignStatus effectiveStatus,
        long donorCount
) {}
