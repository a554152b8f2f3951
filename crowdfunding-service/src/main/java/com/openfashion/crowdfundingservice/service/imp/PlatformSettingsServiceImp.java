package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.SystemPausedException;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.model.PlatformSettings;
import com.openfashion.crowdfundingservice.repository.PlatformSettingsRepository;
import com.openfashion.crowdfundingservice.service.PlatformSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
@RequiredArgsConstructor
public class PlatformSettingsServiceImp implements PlatformSettingsService {

    private final PlatformSettingsRepository settingsRepository;
    private final CrowdfundingProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PlatformSettings current() {
        return settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseGet(this::defaults);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isPaused() {
        return current().isPaused();
    }

    @Override
    @Transactional(readOnly = true)
    public void requireNotPaused(String operation) {
        if (isPaused()) {
            log.warn("Rejected {} while paused", operation);
            throw new SystemPausedException(operation);
        }
    }

    @Override
    @Transactional
    public long allocateCampaignId() {
        PlatformSettings settings = loadOrCreate();
        long next = Math.addExact(settings.getLatestCampaignId(), 1);
        settings.setLatestCampaignId(next);
        settingsRepository.save(settings);
        return next;
    }

    @Override
    @Transactional(readOnly = true)
    public int currentFeeRateBps() {
        return current().getPlatformFeeRateBps();
    }

    @Override
    @Transactional
    public boolean setPaused(boolean paused) {
        PlatformSettings settings = loadOrCreate();
        if (settings.isPaused() == paused) {
            return false;
        }
        settings.setPaused(paused);
        settingsRepository.save(settings);
        return true;
    }

    @Override
    @Transactional
    public int setFeeRate(int feeRateBps) {
        TokenMath.requireBasisPoints(feeRateBps);
        PlatformSettings settings = loadOrCreate();
        int previous = settings.getPlatformFeeRateBps();
        settings.setPlatformFeeRateBps(feeRateBps);
        settingsRepository.save(settings);
        return previous;
    }

    private PlatformSettings loadOrCreate() {
        return settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseGet(() -> {
                    log.info("Initialising platform settings with fee rate {} bps", properties.getDefaultFeeRateBps());
                    return defaults();
                });
    }

    private PlatformSettings defaults() {
        return PlatformSettings.builder()
                .id(PlatformSettings.SINGLETON_ID)
                .latestCampaignId(0)
                .platformFeeRateBps(properties.getDefaultFeeRateBps())
                .paused(false)
                .build();
    }
}
