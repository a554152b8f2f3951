package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidCampaignStateException;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.dto.response.*;
import com.openfashion.crowdfundingservice.model.BalanceLedger;
import com.openfashion.crowdfundingservice.model.Campaign;
import com.openfashion.crowdfundingservice.model.CampaignStatus;
import com.openfashion.crowdfundingservice.model.CollectedFeeTotal;
import com.openfashion.crowdfundingservice.model.DonorRecord;
import com.openfashion.crowdfundingservice.model.PlatformSettings;
import com.openfashion.crowdfundingservice.repository.BalanceLedgerRepository;
import com.openfashion.crowdfundingservice.repository.CampaignRepository;
import com.openfashion.crowdfundingservice.repository.CollectedFeeTotalRepository;
import com.openfashion.crowdfundingservice.repository.DonorRecordRepository;
import com.openfashion.crowdfundingservice.service.CampaignQueryService;
import com.openfashion.crowdfundingservice.service.PlatformSettingsService;
import com.openfashion.crowdfundingservice.service.accounting.CampaignAccounting;
import com.openfashion.crowdfundingservice.service.lifecycle.CampaignLifecycle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the ledger. Nothing here persists a lazy status transition; predicates are
 * answered from the derived status at the current instant.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CampaignQueryServiceImp implements CampaignQueryService {

    private final CampaignRepository campaignRepository;
    private final BalanceLedgerRepository ledgerRepository;
    private final DonorRecordRepository donorRecordRepository;
    private final CollectedFeeTotalRepository collectedFeeTotalRepository;
    private final PlatformSettingsService platformSettingsService;
    private final Clock clock;

    @Override
    public CampaignResponse getCampaign(Long campaignId) {
        return CampaignResponse.from(getCampaignOrThrow(campaignId));
    }

    @Override
    public BalanceResponse getBalance(Long campaignId) {
        getCampaignOrThrow(campaignId);
        return BalanceResponse.from(getLedger(campaignId));
    }

    @Override
    public FundingProgressResponse getFundingProgress(Long campaignId) {
        Campaign campaign = getCampaignOrThrow(campaignId);
        BalanceLedger ledger = getLedger(campaignId);
        return new FundingProgressResponse(
                campaignId,
                ledger.getTotalDonations(),
                campaign.getFundingGoal(),
                TokenMath.percentOf(ledger.getTotalDonations(), campaign.getFundingGoal()));
    }

    @Override
    public CampaignOutcomeResponse getOutcome(Long campaignId) {
        Campaign campaign = getCampaignOrThrow(campaignId);
        CampaignStatus effective = CampaignLifecycle.effectiveStatus(campaign, getLedger(campaignId), clock.instant());
        return new CampaignOutcomeResponse(
                campaignId,
                effective,
                effective == CampaignStatus.SUCCESSFUL,
                effective == CampaignStatus.FAILED);
    }

    @Override
    public CampaignInfoResponse getCampaignInfo(Long campaignId) {
        Campaign campaign = getCampaignOrThrow(campaignId);
        BalanceLedger ledger = getLedger(campaignId);
        return new CampaignInfoResponse(
                CampaignResponse.from(campaign),
                BalanceResponse.from(ledger),
                TokenMath.percentOf(ledger.getTotalDonations(), campaign.getFundingGoal()),
                CampaignLifecycle.effectiveStatus(campaign, ledger, clock.instant()),
                donorRecordRepository.countByCampaignId(campaignId));
    }

    @Override
    public List<String> getDonors(Long campaignId) {
        getCampaignOrThrow(campaignId);
        return donorRecordRepository.findDonorsByCampaignId(campaignId);
    }

    @Override
    public DonorResponse getDonor(Long campaignId, String donor) {
        Campaign campaign = getCampaignOrThrow(campaignId);
        String address = Addresses.normalize("donor", donor);
        DonorRecord record = donorRecordRepository.findByDonorAndCampaignId(address, campaignId)
                .orElseThrow(() -> new InvalidCampaignStateException(campaignId, "no donation found for " + address));
        return new DonorResponse(
                campaignId,
                address,
                record.getTotalDonated(),
                record.getRefundClaimed(),
                CampaignAccounting.refundableFor(record, campaign.getPlatformFeeRateBps()));
    }

    @Override
    public List<Long> getCreatedCampaigns(String creator) {
        return campaignRepository.findIdsByCreator(Addresses.normalize("creator", creator));
    }

    @Override
    public List<Long> getDonatedCampaigns(String donor) {
        return donorRecordRepository.findCampaignIdsByDonor(Addresses.normalize("donor", donor));
    }

    @Override
    public PlatformOverviewResponse getPlatformOverview() {
        PlatformSettings settings = platformSettingsService.current();
        Map<String, BigInteger> collected = new LinkedHashMap<>();
        for (CollectedFeeTotal total : collectedFeeTotalRepository.findAll()) {
            collected.put(total.getToken(), total.getTotalCollected());
        }
        return new PlatformOverviewResponse(
                settings.getLatestCampaignId(),
                settings.getPlatformFeeRateBps(),
                settings.isPaused(),
                collected);
    }

    private Campaign getCampaignOrThrow(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    private BalanceLedger getLedger(Long campaignId) {
        return ledgerRepository.findById(campaignId)
                .orElseGet(() -> BalanceLedger.empty(campaignId));
    }
}
