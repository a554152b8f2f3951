package com.openfashion.crowdfundingservice.service.lifecycle;

import com.openfashion.crowdfundingservice.core.exceptions.InvalidCampaignStateException;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.Campaign;
import com.openfashion.crowdfundingservice.model.CampaignStatus;
import com.openfashion.crowdfundingservice.model.FundingModel;

import java.time.Instant;
import java.util.Optional;

/**
 * Every status change of a campaign goes through this class.
 * <p>
 * ACTIVE is the only non-terminal state. Threshold and deadline transitions are derived by
 * {@link #effectiveStatus}; {@link #evaluate} persists them onto the campaign. Cancellation and a
 * dispute lost by the creator are the two explicit transitions.
 */
public final class CampaignLifecycle {

    private CampaignLifecycle() {}

    public static CampaignStatus effectiveStatus(Campaign campaign, BalanceLedger ledger, Instant now) {
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            return campaign.getStatus();
        }
        if (ledger.getTotalDonations().compareTo(campaign.getFundingGoal()) >= 0) {
            return CampaignStatus.SUCCESSFUL;
        }
        if (campaign.getFundingModel() == FundingModel.ALL_OR_NOTHING && hasEnded(campaign, now)) {
            return CampaignStatus.FAILED;
        }
        return CampaignStatus.ACTIVE;
    }

    public static Optional<StatusTransition> evaluate(Campaign campaign, BalanceLedger ledger, Instant now) {
        CampaignStatus next = effectiveStatus(campaign, ledger, now);
        if (next == campaign.getStatus()) {
            return Optional.empty();
        }
        return Optional.of(apply(campaign, next));
    }

    public static StatusTransition cancel(Campaign campaign, BalanceLedger ledger, Instant now) {
        requireActive(campaign, ledger, now);
        if (ledger.getTotalDonations().signum() != 0) {
            throw new InvalidCampaignStateException(campaign.getId(),
                    "cannot cancel after receiving donations (total " + ledger.getTotalDonations() + ")");
        }
        return apply(campaign, CampaignStatus.DELETED);
    }

    /**
     * Dispute resolved against the creator. Terminal campaigns keep their status.
     */
    public static Optional<StatusTransition> failByDispute(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            return Optional.empty();
        }
        return Optional.of(apply(campaign, CampaignStatus.FAILED));
    }

    public static boolean isWithdrawable(Campaign campaign, Instant now) {
        return switch (campaign.getStatus()) {
            case SUCCESSFUL -> true;
            case ACTIVE -> campaign.getFundingModel() == FundingModel.KEEP_WHAT_YOU_RAISE && hasEnded(campaign, now);
            case FAILED, DELETED -> false;
        };
    }

    public static boolean hasEnded(Campaign campaign, Instant now) {
        return !now.isBefore(campaign.getEndTime());
    }

    public static void requireActive(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            throw new InvalidCampaignStateException(campaign.getId(), "campaign not active (status " + campaign.getStatus() + ")");
        }
    }

    /**
     * Rejects campaigns whose derived status is no longer ACTIVE, including ones that are only
     * waiting for a caller to persist a due deadline or goal transition.
     */
    public static void requireActive(Campaign campaign, BalanceLedger ledger, Instant now) {
        CampaignStatus status = effectiveStatus(campaign, ledger, now);
        if (status != CampaignStatus.ACTIVE) {
            throw new InvalidCampaignStateException(campaign.getId(), "campaign not active (status " + status + ")");
        }
    }

    public static void requireNotDisputed(Campaign campaign) {
        if (campaign.isDisputed()) {
            throw new InvalidCampaignStateException(campaign.getId(), "campaign is disputed");
        }
    }

    private static StatusTransition apply(Campaign campaign, CampaignStatus next) {
        CampaignStatus previous = campaign.getStatus();
        if (previous.isTerminal()) {
            throw new InvalidCampaignStateException(campaign.getId(), "status " + previous + " is terminal");
        }
        campaign.setStatus(next);
        return new StatusTransition(campaign.getId(), previous, next);
    }
}
