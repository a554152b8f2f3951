package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;
import com.openfashion.crowdfundingservice.core.exceptions.SystemNotPausedException;
import com.openfashion.crowdfundingservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.crowdfundingservice.core.security.AccessControl;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.dto.response.FeeCollectionResult;
import com.openfashion.crowdfundingservice.dto.response.FundsTransferResponse;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.Campaign;
import com.openfashion.crowdfundingservice.model.CampaignEventType;
import com.openfashion.crowdfundingservice.model.CollectedFeeTotal;
import com.openfashion.crowdfundingservice.repository.BalanceLedgerRepository;
import com.openfashion.crowdfundingservice.repository.CampaignRepository;
import com.openfashion.crowdfundingservice.repository.CollectedFeeTotalRepository;
import com.openfashion.crowdfundingservice.service.CampaignEventPublisher;
import com.openfashion.crowdfundingservice.service.PlatformAdminService;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class PlatformAdminServiceImp implements PlatformAdminService {

    private final CampaignRepository campaignRepository;
    private final BalanceLedgerRepository ledgerRepository;
    private final CollectedFeeTotalRepository collectedFeeTotalRepository;
    private final PlatformSettingsService platformSettingsService;
    private final TokenGateway tokenGateway;
    private final CampaignEventPublisher eventPublisher;
    private final AccessControl accessControl;
    private final CrowdfundingProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public void pause(String caller) {
        String admin = requireAdmin(caller);
        if (!platformSettingsService.setPaused(true)) {
            log.warn("Pause requested by {} but the system is already paused", admin);
            return;
        }
        eventPublisher.publish(CampaignEventType.PLATFORM_PAUSED, "platform", Map.of("admin", admin));
        log.info("System paused by {}", admin);
    }

    @Override
    @Transactional
    public void unpause(String caller) {
        String admin = requireAdmin(caller);
        if (!platformSettingsService.setPaused(false)) {
            log.warn("Unpause requested by {} but the system is not paused", admin);
            return;
        }
        eventPublisher.publish(CampaignEventType.PLATFORM_UNPAUSED, "platform", Map.of("admin", admin));
        log.info("System unpaused by {}", admin);
    }

    @Override
    @Transactional
    public void flagCampaignAsDisputed(String caller, Long campaignId) {
        String admin = requireAdmin(caller);
        Campaign campaign = getCampaignForUpdate(campaignId);

        if (campaign.isDisputed()) {
            log.warn("Campaign {} is already disputed, ignoring flag from {}", campaignId, admin);
            return;
        }
        BalanceLedger ledger = ledgerRepository.findById(campaignId)
                .orElseGet(() -> BalanceLedger.empty(campaignId));
        CampaignLifecycle.requireActive(campaign, ledger, clock.instant());

        campaign.setDisputed(true);
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.CAMPAIGN_DISPUTED, campaignId, Map.of("admin", admin));
        log.info("Campaign {} flagged as disputed by {}", campaignId, admin);
    }

    @Override
    @Transactional
    public void resolveDispute(String caller, Long campaignId, boolean favorCreator) {
        String admin = requireAdmin(caller);
        Campaign campaign = getCampaignForUpdate(campaignId);

        if (!campaign.isDisputed()) {
            log.warn("Campaign {} is not disputed, ignoring resolution from {}", campaignId, admin);
            return;
        }

        campaign.setDisputed(false);
        Optional<StatusTransition> transition = favorCreator
                ? Optional.empty()
                : CampaignLifecycle.failByDispute(campaign);
        campaignRepository.save(campaign);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("admin", admin);
        details.put("favorCreator", favorCreator);
        details.put("status", campaign.getStatus());
        eventPublisher.publish(CampaignEventType.DISPUTE_RESOLVED, campaignId, details);
        transition.ifPresent(eventPublisher::publishTransition);

        log.info("Dispute on campaign {} resolved {} the creator by {}", campaignId, favorCreator ? "in favor of" : "against", admin);
    }

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public void setPlatformFeeRate(String caller, int feeRateBps) {
        if (caller == null || !accessControl.isOwner(caller)) {
            log.warn("Fee rate change rejected: {} is not the owner", caller);
            throw new UnauthorizedCallerException(caller, "the platform owner");
        }
        if (feeRateBps < 0 || feeRateBps > properties.getMaxFeeRateBps()) {
            throw new InvalidInputException("feeRateBps", feeRateBps, "must be within [0, " + properties.getMaxFeeRateBps() + "]");
        }

        int previous = platformSettingsService.setFeeRate(feeRateBps);
        if (previous == feeRateBps) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousFeeRateBps", previous);
        details.put("feeRateBps", feeRateBps);
        eventPublisher.publish(CampaignEventType.PLATFORM_FEE_RATE_CHANGED, "platform", details);
        log.info("Platform fee rate changed from {} to {} bps", previous, feeRateBps);
    }

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public FeeCollectionResult collectPlatformFees(String caller, String token) {
        String admin = requireAdmin(caller);
        String tokenAddress = Addresses.normalize("token", token);

        List<Long> campaignIds = campaignRepository.findAllByTokenOrderByIdAsc(tokenAddress).stream()
                .map(Campaign::getId)
                .toList();
        if (campaignIds.isEmpty()) {
            return new FeeCollectionResult(tokenAddress, admin, BigInteger.ZERO, 0);
        }

        // Linear in the number of campaigns sharing the token
        BigInteger total = BigInteger.ZERO;
        List<BalanceLedger> swept = new ArrayList<>();
        for (BalanceLedger ledger : ledgerRepository.findAllByCampaignIdIn(campaignIds)) {
            if (ledger.getFeeOutstanding().signum() == 0) {
                continue;
            }
            total = TokenMath.add(total, CampaignAccounting.sweepFees(ledger));
            swept.add(ledger);
        }

        if (total.signum() == 0) {
            log.debug("No outstanding fees for token {}", tokenAddress);
            return new FeeCollectionResult(tokenAddress, admin, BigInteger.ZERO, 0);
        }

        ledgerRepository.saveAll(swept);

        CollectedFeeTotal collected = collectedFeeTotalRepository.findById(tokenAddress)
                .orElseGet(() -> new CollectedFeeTotal(tokenAddress));
        collected.setTotalCollected(TokenMath.add(collected.getTotalCollected(), total));
        collectedFeeTotalRepository.save(collected);

        tokenGateway.push(tokenAddress, admin, total);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("admin", admin);
        details.put("amount", total);
        details.put("campaigns", swept.stream().map(BalanceLedger::getCampaignId).toList());
        eventPublisher.publish(CampaignEventType.PLATFORM_FEES_COLLECTED, tokenAddress, details);

        log.info("Collected {} {} in fees from {} campaign(s)", total, tokenAddress, swept.size());
        return new FeeCollectionResult(tokenAddress, admin, total, swept.size());
    }

    @Override
    @Transactional
    public FundsTransferResponse emergencyWithdraw(String caller, String token, BigInteger amount) {
        String admin = requireAdmin(caller);
        if (!platformSettingsService.isPaused()) {
            throw new SystemNotPausedException("emergencyWithdraw");
        }
        if (!TokenMath.isPositive(amount)) {
            throw new InvalidInputException("amount", amount, "must be greater than zero");
        }
        String tokenAddress = Addresses.normalize("token", token);

        tokenGateway.push(tokenAddress, admin, amount);

        eventPublisher.publish(CampaignEventType.EMERGENCY_WITHDRAWAL, tokenAddress, Map.of("admin", admin, "amount", amount));
        log.warn("Emergency withdrawal of {} {} by {}", amount, tokenAddress, admin);
        return new FundsTransferResponse(null, admin, tokenAddress, amount);
    }

    private String requireAdmin(String caller) {
        if (caller == null || !accessControl.isAdmin(caller)) {
            log.warn("Admin operation rejected for caller {}", caller);
            throw new UnauthorizedCallerException(caller, "an admin");
        }
        return Addresses.normalize("caller", caller);
    }

    private Campaign getCampaignForUpdate(Long campaignId) {
        return campaignRepository.findForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
