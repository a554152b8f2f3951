package com.openfashion.crowdfundingservice.service.lifecycle;

import com.openfashion.crowdfundingservice.model.CampaignStatus;

public record StatusTransition(
        Long campaignId,
        CampaignStatus from,
        CampaignStatus to
) {}
