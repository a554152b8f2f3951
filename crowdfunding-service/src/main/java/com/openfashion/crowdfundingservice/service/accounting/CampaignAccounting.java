package com.openfashion.crowdfundingservice.service.accounting;

import com.openfashion.crowdfundingservice.core.exceptions.ConservationViolationException;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.DonorRecord;

import java.math.BigInteger;

/**
 * Postings against a campaign's balance ledger and donor records.
 * <p>
 * After every posting:
 * {@code totalDonations == withdrawableBalance + feeAccrued + totalRefunded + totalWithdrawn},
 * where {@code feeAccrued == feeCollected + feeOutstanding}.
 */
public final class CampaignAccounting {

    private CampaignAccounting() {}

    /**
     * @return the fee retained from this donation
     */
    public static BigInteger recordDonation(BalanceLedger ledger, DonorRecord donor, BigInteger amount, int feeRateBps) {
        BigInteger fee = TokenMath.feeOf(amount, feeRateBps);

        ledger.setTotalDonations(TokenMath.add(ledger.getTotalDonations(), amount));
        ledger.setFeeAccrued(TokenMath.add(ledger.getFeeAccrued(), fee));
        ledger.setWithdrawableBalance(TokenMath.add(ledger.getWithdrawableBalance(), TokenMath.sub(amount, fee)));
        donor.setTotalDonated(TokenMath.add(donor.getTotalDonated(), amount));

        verifyConservation(ledger);
        return fee;
    }

    /**
     * Net contribution not yet refunded. The fee share of a donation is never refundable.
     */
    public static BigInteger refundableFor(DonorRecord donor, int feeRateBps) {
        BigInteger net = netContribution(donor, feeRateBps);
        return TokenMath.sub(net, donor.getRefundClaimed());
    }

    public static void recordRefund(BalanceLedger ledger, DonorRecord donor, BigInteger refundable, int feeRateBps) {
        BigInteger claimed = TokenMath.add(donor.getRefundClaimed(), refundable);
        if (claimed.compareTo(netContribution(donor, feeRateBps)) > 0) {
            throw new ConservationViolationException("Refund of " + refundable + " exceeds net contribution of donor "
                    + donor.getDonor() + " in campaign " + donor.getCampaignId());
        }

        donor.setRefundClaimed(claimed);
        ledger.setWithdrawableBalance(TokenMath.sub(ledger.getWithdrawableBalance(), refundable));
        ledger.setTotalRefunded(TokenMath.add(ledger.getTotalRefunded(), refundable));

        verifyConservation(ledger);
    }

    /**
     * Moves the whole withdrawable balance out of the ledger.
     *
     * @return the drained amount, zero when nothing was left
     */
    public static BigInteger drainWithdrawable(BalanceLedger ledger) {
        BigInteger amount = ledger.getWithdrawableBalance();
        ledger.setWithdrawableBalance(BigInteger.ZERO);
        ledger.setTotalWithdrawn(TokenMath.add(ledger.getTotalWithdrawn(), amount));

        verifyConservation(ledger);
        return amount;
    }

    /**
     * Marks every outstanding fee as collected.
     *
     * @return the swept amount
     */
    public static BigInteger sweepFees(BalanceLedger ledger) {
        BigInteger outstanding = TokenMath.sub(ledger.getFeeAccrued(), ledger.getFeeCollected());
        ledger.setFeeCollected(ledger.getFeeAccrued());

        verifyConservation(ledger);
        return outstanding;
    }

    public static void verifyConservation(BalanceLedger ledger) {
        if (ledger.getFeeCollected().compareTo(ledger.getFeeAccrued()) > 0) {
            throw new ConservationViolationException("Campaign " + ledger.getCampaignId()
                    + ": fees collected " + ledger.getFeeCollected() + " exceed fees accrued " + ledger.getFeeAccrued());
        }
        BigInteger accountedFor = TokenMath.add(
                TokenMath.add(ledger.getWithdrawableBalance(), ledger.getFeeAccrued()),
                TokenMath.add(ledger.getTotalRefunded(), ledger.getTotalWithdrawn()));

        if (accountedFor.compareTo(ledger.getTotalDonations()) != 0) {
            throw new ConservationViolationException("Campaign " + ledger.getCampaignId()
                    + ": donations " + ledger.getTotalDonations() + " do not match accounted funds " + accountedFor);
        }
    }

    private static BigInteger netContribution(DonorRecord donor, int feeRateBps) {
        return TokenMath.sub(donor.getTotalDonated(), TokenMath.feeOf(donor.getTotalDonated(), feeRateBps));
    }
}
