package com.openfashion.crowdfundingservice;

import com.openfashion.crowdfundingservice.core.annotation.CampaignLocked;
import com.openfashion.crowdfundingservice.core.aspect.CampaignLockCheck;
import com.openfashion.crowdfundingservice.core.exceptions.CampaignBusyException;
import com.openfashion.crowdfundingservice.service.CampaignLockService;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignLockCheckTest {

    private static final Long CAMPAIGN_ID = 12L;
    private static final String OWNER_TOKEN = "owner-token";

    @Mock
    private CampaignLockService lockService;

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private MethodSignature signature;

    @Mock
    private CampaignLocked campaignLocked;

    @InjectMocks
    private CampaignLockCheck aspect;

    @BeforeEach
    void setUp() {
        lenient().when(joinPoint.getSignature()).thenReturn(signature);
        lenient().when(signature.getParameterNames()).thenReturn(new String[]{"caller", "campaignId"});
        lenient().when(joinPoint.getArgs()).thenReturn(new Object[]{"0xabc", CAMPAIGN_ID});
    }

    @Test
    @DisplayName("Should proceed and release when the lock is acquired")
    void testLockCampaign_Success() throws Throwable {
        when(lockService.acquire(CAMPAIGN_ID)).thenReturn(Optional.of(OWNER_TOKEN));
        when(joinPoint.proceed()).thenReturn("done");

        Object result = aspect.lockCampaign(joinPoint, campaignLocked);

        assertThat(result).isEqualTo("done");
        verify(lockService).release(CAMPAIGN_ID, OWNER_TOKEN);
    }

    @Test
    @DisplayName("Should throw CampaignBusyException when another request holds the lock")
    void testLockCampaign_Busy() throws Throwable {
        when(lockService.acquire(CAMPAIGN_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> aspect.lockCampaign(joinPoint, campaignLocked))
                .isInstanceOf(CampaignBusyException.class)
                .hasMessageContaining("12");

        verify(joinPoint, never()).proceed();
        verify(lockService, never()).release(any(), any());
    }

    @Test
    @DisplayName("Should release the lock if the endpoint throws")
    void testLockCampaign_ReleaseOnFailure() throws Throwable {
        when(lockService.acquire(CAMPAIGN_ID)).thenReturn(Optional.of(OWNER_TOKEN));
        when(joinPoint.proceed()).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> aspect.lockCampaign(joinPoint, campaignLocked))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        verify(lockService).release(CAMPAIGN_ID, OWNER_TOKEN);
    }

    @Test
    @DisplayName("Should proceed without locking when no campaignId parameter exists")
    void testLockCampaign_NoCampaignId() throws Throwable {
        when(signature.getParameterNames()).thenReturn(new String[]{"caller"});
        when(joinPoint.getArgs()).thenReturn(new Object[]{"0xabc"});
        when(signature.toShortString()).thenReturn("AdminController.pause(..)");
        when(joinPoint.proceed()).thenReturn("done");

        assertThat(aspect.lockCampaign(joinPoint, campaignLocked)).isEqualTo("done");
        verifyNoInteractions(lockService);
    }
}
