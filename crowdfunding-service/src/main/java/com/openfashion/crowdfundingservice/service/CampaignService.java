package com.openfashion.crowdfundingservice.service;

import com.openfashion.crowdfundingservice.dto.CreateCampaignRequest;
import com.openfashion.crowdfundingservice.dto.UpdateCampaignDetailsRequest;

import java.time.Instant;

public interface CampaignService {

    long createCampaign(String caller, CreateCampaignRequest request);

    void updateCampaignDetails(String caller, Long campaignId, UpdateCampaignDetailsRequest request);

    void changeEndTime(String caller, Long campaignId, Instant newEndTime);

    void cancelCampaign(String caller, Long campaignId);
}
