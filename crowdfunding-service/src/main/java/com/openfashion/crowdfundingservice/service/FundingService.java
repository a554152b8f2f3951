package com.openfashion.crowdfundingservice.service;

import com.openfashion.crowdfundingservice.dto.response.DonationReceipt;
import com.openfashion.crowdfundingservice.dto.response.FundsTransferResponse;

import java.math.BigInteger;

public interface FundingService {

    DonationReceipt donate(String caller, Long campaignId, BigInteger amount);

    FundsTransferResponse claimRefund(String caller, Long campaignId);

    FundsTransferResponse withdrawFunds(String caller, Long campaignId);
}
