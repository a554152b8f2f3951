package com.openfashion.crowdfundingservice.dto.response;

import com.openfashion.crowdfundingservice.model.Campaign;
import com.openfashion.crowdfundingservice.model.CampaignStatus;
import com.openfashion.crowdfundingservice.model.FundingModel;

import java.math.BigInteger;
import java.time.Instant;

public record CampaignResponse(
        Long id,
        String creator,
        int platformFeeRateBps,
        boolean disputed,
        Instant startTime,
        Instant endTime,
        String name,
        String description,
        String url,
        String imageUrl,
        BigInteger fundingGoal,
        FundingModel fundingModel,
        String token,
        CampaignStatus status
) {
    public static CampaignResponse from(Campaign campaign) {
        return new CampaignResponse(
                campaign.getId(),
                campaign.getCreator(),
                campaign.getPlatformFeeRateBps(),
                campaign.isDisputed(),
                campaign.getStartTime(),
                campaign.getEndTime(),
                campaign.getName(),
                campaign.getDescription(),
                campaign.getUrl(),
                campaign.getImageUrl(),
                campaign.getFundingGoal(),
                campaign.getFundingModel(),
                campaign.getToken(),
                campaign.getStatus()
        );
    }
}
