package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidCampaignStateException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;
import com.openfashion.crowdfundingservice.core.exceptions.TemporalViolationException;
import com.openfashion.crowdfundingservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.dto.response.DonationReceipt;
import com.openfashion.crowdfundingservice.dto.response.FundsTransferResponse;
import com.openfashion.crowdfundingservice.model.*;
import com.openfashion.crowdfundingservice.repository.BalanceLedgerRepository;
import com.openfashion.crowdfundingservice.repository.CampaignRepository;
import com.openfashion.crowdfundingservice.repository.DonorRecordRepository;
import com.openfashion.crowdfundingservice.service.CampaignEventPublisher;
import com.openfashion.crowdfundingservice.service.FundingService;
import com.openfashion.crowdfundingservice.service.PlatformSettingsService;
import com.openfashion.crowdfundingservice.service.TokenGateway;
import com.openfashion.crowdfundingservice.service.accounting.CampaignAccounting;
import com.openfashion.crowdfundingservice.service.lifecycle.CampaignLifecycle;
import com.openfashion.crowdfundingservice.service.lifecycle.StatusTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class FundingServiceImp implements FundingService {

    private final CampaignRepository campaignRepository;
    private final BalanceLedgerRepository ledgerRepository;
    private final DonorRecordRepository donorRecordRepository;
    private final PlatformSettingsService platformSettingsService;
    private final TokenGateway tokenGateway;
    private final CampaignEventPublisher eventPublisher;
    private final CrowdfundingProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public DonationReceipt donate(String caller, Long campaignId, BigInteger amount) {
        platformSettingsService.requireNotPaused("donate");
        String donor = Addresses.normalize("caller", caller);

        if (!TokenMath.isPositive(amount)) {
            throw new InvalidInputException("amount", amount, "must be greater than zero");
        }

        Campaign campaign = getCampaignForUpdate(campaignId);
        CampaignLifecycle.requireNotDisputed(campaign);
        if (campaign.getStatus() == CampaignStatus.SUCCESSFUL) {
            throw new InvalidCampaignStateException(campaignId, "funding goal already met");
        }
        CampaignLifecycle.requireActive(campaign);

        Instant now = clock.instant();
        if (now.isBefore(campaign.getStartTime())) {
            throw new TemporalViolationException(campaignId, "campaign not started", now, campaign.getStartTime());
        }
        if (CampaignLifecycle.hasEnded(campaign, now)) {
            throw new TemporalViolationException(campaignId, "campaign ended", now, campaign.getEndTime());
        }

        BalanceLedger ledger = getLedger(campaignId);
        Optional<DonorRecord> existing = donorRecordRepository.findByDonorAndCampaignId(donor, campaignId);
        boolean firstDonation = existing.isEmpty();
        DonorRecord donorRecord = existing.orElseGet(() -> DonorRecord.builder()
                .donor(donor)
                .campaignId(campaignId)
                .build());

        tokenGateway.pull(campaign.getToken(), donor, amount);

        BigInteger fee = CampaignAccounting.recordDonation(ledger, donorRecord, amount, campaign.getPlatformFeeRateBps());
        ledgerRepository.save(ledger);
        donorRecordRepository.save(donorRecord);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("donor", donor);
        details.put("amount", amount);
        details.put("fee", fee);
        details.put("totalDonations", ledger.getTotalDonations());
        details.put("firstDonation", firstDonation);
        eventPublisher.publish(CampaignEventType.DONATION_RECEIVED, campaignId, details);

        CampaignLifecycle.evaluate(campaign, ledger, now).ifPresent(transition -> {
            campaignRepository.save(campaign);
            eventPublisher.publishTransition(transition);
            if (transition.to() == CampaignStatus.SUCCESSFUL) {
                eventPublisher.publish(CampaignEventType.FUNDING_GOAL_REACHED, campaignId,
                        Map.of("totalDonations", ledger.getTotalDonations(), "fundingGoal", campaign.getFundingGoal()));
                log.info("Campaign {} reached its goal of {}", campaignId, campaign.getFundingGoal());
            }
        });

        log.info("Donation of {} (fee {}) from {} accepted for campaign {}", amount, fee, donor, campaignId);
        return new DonationReceipt(campaignId, donor, amount, fee, ledger.getTotalDonations(), campaign.getStatus());
    }

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public FundsTransferResponse claimRefund(String caller, Long campaignId) {
        platformSettingsService.requireNotPaused("claimRefund");
        String donor = Addresses.normalize("caller", caller);

        Campaign campaign = getCampaignForUpdate(campaignId);
        CampaignLifecycle.requireNotDisputed(campaign);

        Instant now = clock.instant();
        BalanceLedger ledger = getLedger(campaignId);
        applyLifecycle(campaign, ledger, now);

        if (campaign.getStatus() != CampaignStatus.FAILED) {
            throw new InvalidCampaignStateException(campaignId, "no refund available (status " + campaign.getStatus() + ")");
        }
        if (campaign.getFundingModel() != FundingModel.ALL_OR_NOTHING) {
            throw new InvalidCampaignStateException(campaignId, "no refund available for " + campaign.getFundingModel() + " campaigns");
        }

        DonorRecord donorRecord = donorRecordRepository.findByDonorAndCampaignId(donor, campaignId)
                .filter(r -> r.getTotalDonated().signum() > 0)
                .orElseThrow(() -> new InvalidCampaignStateException(campaignId, "no donation found for " + donor));

        Instant refundDeadline = campaign.getEndTime().plus(properties.getRefundGracePeriod());
        if (now.isAfter(refundDeadline)) {
            throw new TemporalViolationException(campaignId, "refund window expired", now, refundDeadline);
        }

        BigInteger refundable = CampaignAccounting.refundableFor(donorRecord, campaign.getPlatformFeeRateBps());
        if (refundable.signum() == 0) {
            throw new InvalidCampaignStateException(campaignId, "already refunded: " + donor);
        }

        CampaignAccounting.recordRefund(ledger, donorRecord, refundable, campaign.getPlatformFeeRateBps());
        donorRecordRepository.save(donorRecord);
        ledgerRepository.save(ledger);

        tokenGateway.push(campaign.getToken(), donor, refundable);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("donor", donor);
        details.put("amount", refundable);
        details.put("refundClaimed", donorRecord.getRefundClaimed());
        eventPublisher.publish(CampaignEventType.REFUND_CLAIMED, campaignId, details);

        log.info("Refunded {} to {} from campaign {}", refundable, donor, campaignId);
        return new FundsTransferResponse(campaignId, donor, campaign.getToken(), refundable);
    }

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public FundsTransferResponse withdrawFunds(String caller, Long campaignId) {
        platformSettingsService.requireNotPaused("withdrawFunds");

        Campaign campaign = getCampaignForUpdate(campaignId);
        if (caller == null || !campaign.isCreator(caller)) {
            log.warn("Withdrawal from campaign {} rejected: {} is not the creator", campaignId, caller);
            throw new UnauthorizedCallerException(caller, campaignId);
        }
        CampaignLifecycle.requireNotDisputed(campaign);

        Instant now = clock.instant();
        BalanceLedger ledger = getLedger(campaignId);
        applyLifecycle(campaign, ledger, now);

        if (!CampaignLifecycle.isWithdrawable(campaign, now)) {
            throw withdrawalRejection(campaign, now);
        }
        if (ledger.getWithdrawableBalance().signum() == 0) {
            throw new InvalidCampaignStateException(campaignId, "no funds to withdraw");
        }

        BigInteger amount = CampaignAccounting.drainWithdrawable(ledger);
        ledgerRepository.save(ledger);

        tokenGateway.push(campaign.getToken(), campaign.getCreator(), amount);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("creator", campaign.getCreator());
        details.put("amount", amount);
        details.put("totalWithdrawn", ledger.getTotalWithdrawn());
        eventPublisher.publish(CampaignEventType.FUNDS_WITHDRAWN, campaignId, details);

        log.info("Creator {} withdrew {} from campaign {}", campaign.getCreator(), amount, campaignId);
        return new FundsTransferResponse(campaignId, campaign.getCreator(), campaign.getToken(), amount);
    }

    private RuntimeException withdrawalRejection(Campaign campaign, Instant now) {
        Long campaignId = campaign.getId();
        if (campaign.getStatus() == CampaignStatus.DELETED) {
            return new InvalidCampaignStateException(campaignId, "campaign deleted");
        }
        boolean ended = CampaignLifecycle.hasEnded(campaign, now);
        if (campaign.getStatus() == CampaignStatus.FAILED && !ended) {
            return new InvalidCampaignStateException(campaignId, "campaign failed");
        }
        if (!ended) {
            return new TemporalViolationException(campaignId, "deadline not reached", now, campaign.getEndTime());
        }
        return new InvalidCampaignStateException(campaignId, "funding goal not reached");
    }

    private void applyLifecycle(Campaign campaign, BalanceLedger ledger, Instant now) {
        Optional<StatusTransition> transition = CampaignLifecycle.evaluate(campaign, ledger, now);
        transition.ifPresent(t -> {
            campaignRepository.save(campaign);
            eventPublisher.publishTransition(t);
            log.info("Campaign {} moved from {} to {}", t.campaignId(), t.from(), t.to());
        });
    }

    private BalanceLedger getLedger(Long campaignId) {
        return ledgerRepository.findById(campaignId)
                .orElseGet(() -> BalanceLedger.empty(campaignId));
    }

    private Campaign getCampaignForUpdate(Long campaignId) {
        return campaignRepository.findForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
