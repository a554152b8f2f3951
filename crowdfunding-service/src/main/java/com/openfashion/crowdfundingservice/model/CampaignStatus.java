package com.openfashion.crowdfundingservice.model;

public enum CampaignStatus {
    ACTIVE,
    SUCCESSFUL, // Goal reached, creator may withdraw
    FAILED, // AllOrNothing deadline missed or dispute lost, donors may claim refunds
    DELETED; // Cancelled before any donation

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
