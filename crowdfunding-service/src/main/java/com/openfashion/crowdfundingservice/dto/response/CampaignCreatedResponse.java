package com.openfashion.crowdfundingservice.dto.response;

public record CampaignCreatedResponse(long campaignId) {}
