package com.openfashion.crowdfundingservice.service;

import java.util.Optional;

public interface CampaignLockService {

    /**
     * @return the ownership token, empty if another request holds the lock
     */
    Optional<String> acquire(Long campaignId);

    void release(Long campaignId, String ownerToken);
}
