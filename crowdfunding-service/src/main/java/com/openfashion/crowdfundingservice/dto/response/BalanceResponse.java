package com.openfashion.crowdfundingservice.dto.response;

import com.openfashion.crowdfundingservice.model.BalanceLedger;

import java.math.BigInteger;

public record BalanceResponse(
        Long campaignId,
        BigInteger totalDonations,
        BigInteger feeAccrued,
        BigInteger feeCollected,
        BigInteger feeOutstanding,
        BigInteger withdrawableBalance,
        BigInteger totalRefunded,
        BigInteger totalWithdrawn
) {
    public static BalanceResponse from(BalanceLedger ledger) {
        return new BalanceResponse(
                ledger.getCampaignId(),
                ledger.getTotalDonations(),
                ledger.getFeeAccrued(),
                ledger.getFeeCollected(),
                ledger.getFeeOutstanding(),
                ledger.getWithdrawableBalance(),
                ledger.getTotalRefunded(),
                ledger.getTotalWithdrawn()
        );
    }
}
