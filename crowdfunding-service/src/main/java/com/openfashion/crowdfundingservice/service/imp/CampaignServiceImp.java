package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;
import com.openfashion.crowdfundingservice.core.exceptions.TemporalViolationException;
import com.openfashion.crowdfundingservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.dto.CreateCampaignRequest;
import com.openfashion.crowdfundingservice.dto.UpdateCampaignDetailsRequest;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.Campaign;
import com.openfashion.crowdfundingservice.model.CampaignEventType;
import com.openfashion.crowdfundingservice.model.CampaignStatus;
import com.openfashion.crowdfundingservice.repository.BalanceLedgerRepository;
import com.openfashion.crowdfundingservice.repository.CampaignRepository;
import com.openfashion.crowdfundingservice.service.CampaignEventPublisher;
import com.openfashion.crowdfundingservice.service.CampaignService;
import com.openfashion.crowdfundingservice.service.PlatformSettingsService;
import com.openfashion.crowdfundingservice.service.TokenGateway;
import com.openfashion.crowdfundingservice.service.lifecycle.CampaignLifecycle;
import com.openfashion.crowdfundingservice.service.lifecycle.StatusTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class CampaignServiceImp implements CampaignService {

    private final CampaignRepository campaignRepository;
    private final BalanceLedgerRepository ledgerRepository;
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
    public long createCampaign(String caller, CreateCampaignRequest request) {
        platformSettingsService.requireNotPaused("createCampaign");
        String creator = Addresses.normalize("caller", caller);

        validateTimeframe(request.startTime(), request.endTime());

        if (request.fundingGoal() == null || request.fundingGoal().compareTo(properties.getMinFundingGoal()) < 0) {
            throw new InvalidInputException("fundingGoal", request.fundingGoal(),
                    "below minimum " + properties.getMinFundingGoal());
        }
        if (request.fundingModel() == null) {
            throw new InvalidInputException("fundingModel", null, "is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidInputException("name", request.name(), "must not be blank");
        }

        String token = Addresses.normalize("token", request.token());
        if (!tokenGateway.isContract(token)) {
            throw new InvalidInputException("token", token, "no contract deployed at address");
        }

        long campaignId = platformSettingsService.allocateCampaignId();
        int feeRateBps = platformSettingsService.currentFeeRateBps();

        Campaign campaign = Campaign.builder()
                .id(campaignId)
                .creator(creator)
                .platformFeeRateBps(feeRateBps)
                .disputed(false)
                .startTime(request.startTime())
                .endTime(request.endTime())
                .name(request.name())
                .description(request.description())
                .url(request.url())
                .imageUrl(request.imageUrl())
                .fundingGoal(request.fundingGoal())
                .fundingModel(request.fundingModel())
                .token(token)
                .status(CampaignStatus.ACTIVE)
                .build();

        campaignRepository.save(campaign);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("creator", creator);
        details.put("fundingGoal", request.fundingGoal());
        details.put("fundingModel", request.fundingModel());
        details.put("token", token);
        details.put("platformFeeRateBps", feeRateBps);
        details.put("endTime", request.endTime());
        eventPublisher.publish(CampaignEventType.CAMPAIGN_CREATED, campaignId, details);

        log.info("Campaign {} created by {} with goal {} ({}, {} bps)",
                campaignId, creator, request.fundingGoal(), request.fundingModel(), feeRateBps);
        return campaignId;
    }

    @Override
    @Transactional
    public void updateCampaignDetails(String caller, Long campaignId, UpdateCampaignDetailsRequest request) {
        platformSettingsService.requireNotPaused("updateCampaignDetails");
        Campaign campaign = getEditableCampaign(caller, campaignId, clock.instant());

        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidInputException("name", request.name(), "must not be blank");
        }

        campaign.setName(request.name());
        campaign.setDescription(request.description());
        campaign.setUrl(request.url());
        campaign.setImageUrl(request.imageUrl());
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.CAMPAIGN_UPDATED, campaignId, Map.of("name", request.name()));
        log.info("Campaign {} details updated", campaignId);
    }

    @Override
    @Transactional
    public void changeEndTime(String caller, Long campaignId, Instant newEndTime) {
        platformSettingsService.requireNotPaused("changeEndTime");
        Instant now = clock.instant();
        Campaign campaign = getEditableCampaign(caller, campaignId, now);

        if (CampaignLifecycle.hasEnded(campaign, now)) {
            throw new TemporalViolationException(campaignId, "campaign ended", now, campaign.getEndTime());
        }
        if (newEndTime == null || !newEndTime.isAfter(now)) {
            throw new InvalidInputException("endTime", newEndTime, "must be in the future");
        }
        validateTimeframe(campaign.getStartTime(), newEndTime);

        Instant previous = campaign.getEndTime();
        campaign.setEndTime(newEndTime);
        campaignRepository.save(campaign);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousEndTime", previous);
        details.put("endTime", newEndTime);
        eventPublisher.publish(CampaignEventType.CAMPAIGN_END_TIME_CHANGED, campaignId, details);
        log.info("Campaign {} end time moved from {} to {}", campaignId, previous, newEndTime);
    }

    @Override
    @Transactional
    public void cancelCampaign(String caller, Long campaignId) {
        platformSettingsService.requireNotPaused("cancelCampaign");
        Campaign campaign = getCampaignForUpdate(campaignId);
        requireCreator(campaign, caller);

        BalanceLedger ledger = getLedger(campaignId);

        StatusTransition transition = CampaignLifecycle.cancel(campaign, ledger, clock.instant());
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.CAMPAIGN_CANCELLED, campaignId, Map.of("creator", campaign.getCreator()));
        eventPublisher.publishTransition(transition);
        log.info("Campaign {} cancelled by its creator", campaignId);
    }

    private Campaign getEditableCampaign(String caller, Long campaignId, Instant now) {
        Campaign campaign = getCampaignForUpdate(campaignId);
        requireCreator(campaign, caller);
        CampaignLifecycle.requireActive(campaign, getLedger(campaignId), now);
        CampaignLifecycle.requireNotDisputed(campaign);
        return campaign;
    }

    private BalanceLedger getLedger(Long campaignId) {
        return ledgerRepository.findById(campaignId)
                .orElseGet(() -> BalanceLedger.empty(campaignId));
    }

    private void validateTimeframe(Instant startTime, Instant endTime) {
        if (startTime == null || endTime == null) {
            throw new InvalidInputException("timeframe", startTime + " - " + endTime, "start and end time are required");
        }
        if (!startTime.isBefore(endTime)) {
            throw new InvalidInputException("endTime", endTime, "must be after start time " + startTime);
        }
        Duration period = Duration.between(startTime, endTime);
        if (period.compareTo(properties.getMinFundingPeriod()) < 0) {
            throw new InvalidInputException("fundingPeriod", period, "shorter than minimum " + properties.getMinFundingPeriod());
        }
        if (period.compareTo(properties.getMaxFundingPeriod()) > 0) {
            throw new InvalidInputException("fundingPeriod", period, "longer than maximum " + properties.getMaxFundingPeriod());
        }
    }

    private void requireCreator(Campaign campaign, String caller) {
        if (caller == null || !campaign.isCreator(caller)) {
            log.warn("Caller {} rejected on campaign {}: not the creator", caller, campaign.getId());
            throw new UnauthorizedCallerException(caller, campaign.getId());
        }
    }

    private Campaign getCampaignForUpdate(Long campaignId) {
        return campaignRepository.findForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
