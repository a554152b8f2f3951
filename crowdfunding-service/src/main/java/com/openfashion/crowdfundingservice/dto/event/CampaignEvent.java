package com.openfashion.crowdfundingservice.dto.event;

import com.openfashion.crowdfundingservice.model.CampaignEventType;

import java.time.Instant;
import java.util.Map;

public record CampaignEvent(
        CampaignEventType eventType,
        String aggregateId,
        Instant occurredAt,
        Map<String, Object> details
) {}
