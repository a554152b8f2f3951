package com.openfashion.crowdfundingservice.service;

import com.openfashion.crowdfundingservice.dto.response.FeeCollectionResult;
import com.openfashion.crowdfundingservice.dto.response.FundsTransferResponse;

import java.math.BigInteger;

public interface PlatformAdminService {

    void pause(String caller);

    void unpause(String caller);

    void flagCampaignAsDisputed(String caller, Long campaignId);

    void resolveDispute(String caller, Long campaignId, boolean favorCreator);

    void setPlatformFeeRate(String caller, int feeRateBps);

    FeeCollectionResult collectPlatformFees(String caller, String token);

    FundsTransferResponse emergencyWithdraw(String caller, String token, BigInteger amount);
}
