package com.openfashion.crowdfundingservice.service;

import com.openfashion.crowdfundingservice.dto.response.*;

import java.util.List;

public interface CampaignQueryService {

    CampaignResponse getCampaign(Long campaignId);

    BalanceResponse getBalance(Long campaignId);

    FundingProgressResponse getFundingProgress(Long campaignId);

    CampaignOutcomeResponse getOutcome(Long campaignId);

    CampaignInfoResponse getCampaignInfo(Long campaignId);

    List<String> getDonors(Long campaignId);

    DonorResponse getDonor(Long campaignId, String donor);

    List<Long> getCreatedCampaigns(String creator);

    List<Long> getDonatedCampaigns(String donor);

    PlatformOverviewResponse getPlatformOverview();
}
