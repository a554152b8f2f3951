package com.openfashion.crowdfundingservice.core.aspect;

import com.openfashion.crowdfundingservice.core.annotation.CampaignLocked;
import com.openfashion.crowdfundingservice.core.exceptions.CampaignBusyException;
import com.openfashion.crowdfundingservice.service.CampaignLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class CampaignLockCheck {

    static final String CAMPAIGN_ID_PARAMETER = "campaignId";

    private final CampaignLockService campaignLockService;

    @Around("@annotation(campaignLocked)")
    public Object lockCampaign(ProceedingJoinPoint joinPoint, CampaignLocked campaignLocked) throws Throwable {
        Long campaignId = findCampaignId(joinPoint);

        if (campaignId == null) {
            log.warn("Method {} marked @CampaignLocked but no campaignId found in arguments.",
                    joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }

        String ownerToken = campaignLockService.acquire(campaignId)
                .orElseThrow(() -> new CampaignBusyException(campaignId));

        try {
            return joinPoint.proceed();
        } catch (Throwable ex) {
            log.debug("Execution failed while holding lock for campaign {}. Releasing lock.", campaignId);
            throw ex;
        } finally {
            campaignLockService.release(campaignId, ownerToken);
        }
    }

    private Long findCampaignId(ProceedingJoinPoint joinPoint) {
        String[] names = ((MethodSignature) joinPoint.getSignature()).getParameterNames();
        Object[] args = joinPoint.getArgs();
        if (names == null) {
            return null;
        }
        for (int i = 0; i < names.length; i++) {
            if (CAMPAIGN_ID_PARAMETER.equals(names[i]) && args[i] instanceof Long id) {
                return id;
            }
        }
        return null;
    }
}
