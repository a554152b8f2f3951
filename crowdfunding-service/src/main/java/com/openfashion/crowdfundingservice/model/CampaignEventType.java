package com.openfashion.crowdfundingservice.model;

public enum CampaignEventType {

    CAMPAIGN_CREATED(EventTopic.LIFECYCLE),
    CAMPAIGN_UPDATED(EventTopic.LIFECYCLE),
    CAMPAIGN_END_TIME_CHANGED(EventTopic.LIFECYCLE),
    CAMPAIGN_CANCELLED(EventTopic.LIFECYCLE),
    CAMPAIGN_STATUS_CHANGED(EventTopic.LIFECYCLE),
    FUNDING_GOAL_REACHED(EventTopic.LIFECYCLE),
    CAMPAIGN_DISPUTED(EventTopic.LIFECYCLE),
    DISPUTE_RESOLVED(EventTopic.LIFECYCLE),

    DONATION_RECEIVED(EventTopic.FUNDS),
    REFUND_CLAIMED(EventTopic.FUNDS),
    FUNDS_WITHDRAWN(EventTopic.FUNDS),

    PLATFORM_FEE_RATE_CHANGED(EventTopic.ADMIN),
    PLATFORM_FEES_COLLECTED(EventTopic.ADMIN),
    EMERGENCY_WITHDRAWAL(EventTopic.ADMIN),
    PLATFORM_PAUSED(EventTopic.ADMIN),
    PLATFORM_UNPAUSED(EventTopic.ADMIN);

    private final EventTopic topic;

    CampaignEventType(EventTopic topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic.name;
    }

    private enum EventTopic {
        LIFECYCLE("campaign.lifecycle"),
        FUNDS("campaign.funds"),
        ADMIN("platform.admin");

        private final String name;

        EventTopic(String name) {
            this.name = name;
        }
    }
}
