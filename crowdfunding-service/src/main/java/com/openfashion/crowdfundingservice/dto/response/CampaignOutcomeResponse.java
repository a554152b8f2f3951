package com.openfashion.crowdfundingservice.dto.response;

import com.openfashion.crowdfundingservice.model.CampaignStatus;

public record CampaignOutcomeResponse(
        Long campaignId,
        CampaignStatus status,
        boolean successful,
        boolean failed
) {}
