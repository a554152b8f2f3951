package com.openfashion.crowdfundingservice.dto.response;

import com.openfashion.crowdfundingservice.model.CampaignStatus;

import java.math.BigInteger;

public record DonationReceipt(
        Long campaignId,
        String donor,
        BigInteger amount,
        BigInteger fee,
        BigInteger totalDonations,
        CampaignStatus status
) {}
