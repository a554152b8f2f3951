package com.openfashion.crowdfundingservice;

import com.openfashion.crowdfundingservice.core.exceptions.ConservationViolationException;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.DonorRecord;
import com.openfashion.crowdfundingservice.service.accounting.CampaignAccounting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CampaignAccountingTest {

    private static final int FEE_BPS = 100;

    private BalanceLedger ledger;
    private DonorRecord alice;
    private DonorRecord bob;

    @BeforeEach
    void setUp() {
        ledger = BalanceLedger.empty(1L);
        alice = DonorRecord.builder().donor("0xa11ce00000000000000000000000000000000000").campaignId(1L).build();
        bob = DonorRecord.builder().donor("0xb0b0000000000000000000000000000000000000").campaignId(1L).build();
    }

    @Test
    @DisplayName("Donation splits into fee and withdrawable balance")
    void testRecordDonation() {
        BigInteger fee = CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);

        assertThat(fee).isEqualTo(BigInteger.valueOf(6));
        assertThat(ledger.getTotalDonations()).isEqualTo(BigInteger.valueOf(600));
        assertThat(ledger.getFeeAccrued()).isEqualTo(BigInteger.valueOf(6));
        assertThat(ledger.getWithdrawableBalance()).isEqualTo(BigInteger.valueOf(594));
        assertThat(alice.getTotalDonated()).isEqualTo(BigInteger.valueOf(600));
    }

    @Test
    @DisplayName("Refund returns the net contribution once and keeps the fee")
    void testRecordRefund() {
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);
        CampaignAccounting.recordDonation(ledger, bob, BigInteger.valueOf(150), FEE_BPS);

        BigInteger refundable = CampaignAccounting.refundableFor(alice, FEE_BPS);
        CampaignAccounting.recordRefund(ledger, alice, refundable, FEE_BPS);

        assertThat(refundable).isEqualTo(BigInteger.valueOf(594));
        assertThat(alice.getRefundClaimed()).isEqualTo(BigInteger.valueOf(594));
        assertThat(CampaignAccounting.refundableFor(alice, FEE_BPS)).isZero();
        assertThat(ledger.getTotalRefunded()).isEqualTo(BigInteger.valueOf(594));
        assertThat(ledger.getWithdrawableBalance()).isEqualTo(BigInteger.valueOf(149));
        assertThat(ledger.getFeeAccrued()).isEqualTo(BigInteger.valueOf(7));
    }

    @Test
    @DisplayName("Refunding more than the net contribution is a conservation violation")
    void testRecordRefund_Excess() {
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);

        assertThatThrownBy(() -> CampaignAccounting.recordRefund(ledger, alice, BigInteger.valueOf(595), FEE_BPS))
                .isInstanceOf(ConservationViolationException.class);
    }

    @Test
    @DisplayName("Per-donor fee floors never leave refunds short of the pool")
    void testRefundsFitWithinWithdrawable() {
        // 3 x 150 at 1%: per-donation fees 1 each, per-donor net computed on the total
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(150), FEE_BPS);
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(150), FEE_BPS);
        CampaignAccounting.recordDonation(ledger, bob, BigInteger.valueOf(150), FEE_BPS);

        CampaignAccounting.recordRefund(ledger, alice, CampaignAccounting.refundableFor(alice, FEE_BPS), FEE_BPS);
        CampaignAccounting.recordRefund(ledger, bob, CampaignAccounting.refundableFor(bob, FEE_BPS), FEE_BPS);

        assertThat(ledger.getTotalRefunded()).isEqualTo(BigInteger.valueOf(297 + 149));
        assertThat(ledger.getWithdrawableBalance()).isEqualTo(BigInteger.ONE);
        CampaignAccounting.verifyConservation(ledger);
    }

    @Test
    @DisplayName("Withdrawal drains the balance and sweeping fees leaves conservation intact")
    void testDrainAndSweep() {
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);
        CampaignAccounting.recordDonation(ledger, bob, BigInteger.valueOf(400), FEE_BPS);

        BigInteger withdrawn = CampaignAccounting.drainWithdrawable(ledger);
        BigInteger swept = CampaignAccounting.sweepFees(ledger);

        assertThat(withdrawn).isEqualTo(BigInteger.valueOf(990));
        assertThat(swept).isEqualTo(BigInteger.TEN);
        assertThat(ledger.getWithdrawableBalance()).isZero();
        assertThat(ledger.getFeeOutstanding()).isZero();
        assertThat(CampaignAccounting.sweepFees(ledger)).isZero();
        assertThat(CampaignAccounting.drainWithdrawable(ledger)).isZero();
    }

    @Test
    @DisplayName("A tampered ledger fails the conservation check")
    void testVerifyConservation_Tampered() {
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);
        ledger.setWithdrawableBalance(BigInteger.valueOf(1000));

        assertThatThrownBy(() -> CampaignAccounting.verifyConservation(ledger))
                .isInstanceOf(ConservationViolationException.class)
                .hasMessageContaining("Campaign 1");
    }

    @Test
    @DisplayName("Collecting more fees than accrued is rejected")
    void testVerifyConservation_OverCollected() {
        CampaignAccounting.recordDonation(ledger, alice, BigInteger.valueOf(600), FEE_BPS);
        ledger.setFeeCollected(BigInteger.valueOf(7));

        assertThatThrownBy(() -> CampaignAccounting.verifyConservation(ledger))
                .isInstanceOf(ConservationViolationException.class)
                .hasMessageContaining("fees collected");
    }
}
