package com.openfashion.crowdfundingservice.service;

import com.openfashion.crowdfundingservice.model.PlatformSettings;

public interface PlatformSettingsService {

    PlatformSettings current();

    boolean isPaused();

    void requireNotPaused(String operation);

    long allocateCampaignId();

    int currentFeeRateBps();

    /**
     * @return false when the flag already had the requested value
     */
    boolean setPaused(boolean paused);

    /**
     * @return the previous rate
     */
    int setFeeRate(int feeRateBps);
}
