package com.openfashion.crowdfundingservice;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.*;
import com.openfashion.crowdfundingservice.dto.CreateCampaignRequest;
import com.openfashion.crowdfundingservice.dto.UpdateCampaignDetailsRequest;
import com.openfashion.crowdfundingservice.model.*;
import com.openfashion.crowdfundingservice.repository.BalanceLedgerRepository;
import com.openfashion.crowdfundingservice.repository.CampaignRepository;
import com.openfashion.crowdfundingservice.service.CampaignEventPublisher;
import com.openfashion.crowdfundingservice.service.PlatformSettingsService;
import com.openfashion.crowdfundingservice.service.TokenGateway;
import com.openfashion.crowdfundingservice.service.imp.CampaignServiceImp;
import com.openfashion.crowdfundingservice.service.lifecycle.StatusTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignServiceUnitTest {

    private static final String TOKEN = "0x00000000000000000000000000000000000000c0";
    private static final String CREATOR = "0x1111111111111111111111111111111111111111";
    private static final String STRANGER = "0x2222222222222222222222222222222222222222";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private BalanceLedgerRepository ledgerRepository;
    @Mock
    private PlatformSettingsService platformSettingsService;
    @Mock
    private TokenGateway tokenGateway;
    @Mock
    private CampaignEventPublisher eventPublisher;

    private MutableClock clock;
    private CampaignServiceImp campaignService;
    private Campaign existing;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        campaignService = new CampaignServiceImp(campaignRepository, ledgerRepository, platformSettingsService,
                tokenGateway, eventPublisher, new CrowdfundingProperties(), clock);

        existing = Campaign.builder()
                .id(3L)
                .creator(CREATOR)
                .platformFeeRateBps(100)
                .startTime(NOW.minus(Duration.ofDays(1)))
                .endTime(NOW.plus(Duration.ofDays(10)))
                .name("Linen shirts")
                .fundingGoal(BigInteger.valueOf(5000))
                .fundingModel(FundingModel.ALL_OR_NOTHING)
                .token(TOKEN)
                .status(CampaignStatus.ACTIVE)
                .build();
        lenient().when(campaignRepository.findForUpdate(3L)).thenReturn(Optional.of(existing));
    }

    @Test
    @DisplayName("Should create an active campaign with the next id and the current fee rate")
    void testCreateCampaign_Success() {
        when(tokenGateway.isContract(TOKEN)).thenReturn(true);
        when(platformSettingsService.allocateCampaignId()).thenReturn(7L);
        when(platformSettingsService.currentFeeRateBps()).thenReturn(100);

        long id = campaignService.createCampaign(CREATOR.toUpperCase().replace("0X", "0x"), validRequest());

        ArgumentCaptor<Campaign> captor = ArgumentCaptor.forClass(Campaign.class);
        verify(campaignRepository).save(captor.capture());
        Campaign saved = captor.getValue();

        assertThat(id).isEqualTo(7L);
        assertThat(saved.getId()).isEqualTo(7L);
        assertThat(saved.getCreator()).isEqualTo(CREATOR);
        assertThat(saved.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
        assertThat(saved.getPlatformFeeRateBps()).isEqualTo(100);
        assertThat(saved.isDisputed()).isFalse();
        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_CREATED), eq(7L), anyMap());
    }

    @Test
    @DisplayName("Should reject funding periods outside the configured bounds")
    void testCreateCampaign_InvalidPeriod() {
        CreateCampaignRequest tooShort = request(NOW, NOW.plus(Duration.ofHours(12)), BigInteger.TEN);
        CreateCampaignRequest tooLong = request(NOW, NOW.plus(Duration.ofDays(366)), BigInteger.TEN);
        CreateCampaignRequest reversed = request(NOW, NOW.minus(Duration.ofDays(2)), BigInteger.TEN);

        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR, tooShort))
                .isInstanceOf(InvalidInputException.class).hasMessageContaining("shorter than minimum");
        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR, tooLong))
                .isInstanceOf(InvalidInputException.class).hasMessageContaining("longer than maximum");
        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR, reversed))
                .isInstanceOf(InvalidInputException.class);

        verify(platformSettingsService, never()).allocateCampaignId();
    }

    @Test
    @DisplayName("Should reject a zero goal and a token without contract code")
    void testCreateCampaign_InvalidGoalOrToken() {
        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR,
                request(NOW, NOW.plus(Duration.ofDays(30)), BigInteger.ZERO)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("fundingGoal");

        when(tokenGateway.isContract(TOKEN)).thenReturn(false);
        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR, validRequest()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("no contract deployed");

        verify(campaignRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject creation while the system is paused")
    void testCreateCampaign_Paused() {
        doThrow(new SystemPausedException("createCampaign")).when(platformSettingsService).requireNotPaused("createCampaign");

        assertThatThrownBy(() -> campaignService.createCampaign(CREATOR, validRequest()))
                .isInstanceOf(SystemPausedException.class);
    }

    @Test
    @DisplayName("Creator can update details of an active campaign, others cannot")
    void testUpdateDetails() {
        UpdateCampaignDetailsRequest update = new UpdateCampaignDetailsRequest("Linen shirts v2", "desc", null, null);

        assertThatThrownBy(() -> campaignService.updateCampaignDetails(STRANGER, 3L, update))
                .isInstanceOf(UnauthorizedCallerException.class);

        campaignService.updateCampaignDetails(CREATOR, 3L, update);

        assertThat(existing.getName()).isEqualTo("Linen shirts v2");
        assertThat(existing.getDescription()).isEqualTo("desc");
        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_UPDATED), eq(3L), anyMap());
    }

    @Test
    @DisplayName("Disputed campaign cannot be edited")
    void testUpdateDetails_Disputed() {
        existing.setDisputed(true);

        assertThatThrownBy(() -> campaignService.updateCampaignDetails(CREATOR, 3L,
                new UpdateCampaignDetailsRequest("x", null, null, null)))
                .isInstanceOf(InvalidCampaignStateException.class)
                .hasMessageContaining("disputed");
    }

    @Test
    @DisplayName("End time must move into the future and stay within the period bounds")
    void testChangeEndTime() {
        assertThatThrownBy(() -> campaignService.changeEndTime(CREATOR, 3L, NOW.minusSeconds(1)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("must be in the future");
        assertThatThrownBy(() -> campaignService.changeEndTime(CREATOR, 3L, NOW.plus(Duration.ofDays(400))))
                .isInstanceOf(InvalidInputException.class);

        Instant newEnd = NOW.plus(Duration.ofDays(20));
        campaignService.changeEndTime(CREATOR, 3L, newEnd);

        assertThat(existing.getEndTime()).isEqualTo(newEnd);
        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_END_TIME_CHANGED), eq(3L), anyMap());
    }

    @Test
    @DisplayName("Cancel deletes a campaign without donations")
    void testCancel_Success() {
        when(ledgerRepository.findById(3L)).thenReturn(Optional.empty());

        campaignService.cancelCampaign(CREATOR, 3L);

        assertThat(existing.getStatus()).isEqualTo(CampaignStatus.DELETED);
        verify(eventPublisher).publishTransition(new StatusTransition(3L, CampaignStatus.ACTIVE, CampaignStatus.DELETED));
    }

    @Test
    @DisplayName("Cancel is refused once donations arrived")
    void testCancel_WithDonations() {
        BalanceLedger ledger = BalanceLedger.empty(3L);
        ledger.setTotalDonations(BigInteger.ONE);
        when(ledgerRepository.findById(3L)).thenReturn(Optional.of(ledger));

        assertThatThrownBy(() -> campaignService.cancelCampaign(CREATOR, 3L))
                .isInstanceOf(InvalidCampaignStateException.class)
                .hasMessageContaining("cannot cancel");
        assertThat(existing.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
    }

    @Test
    @DisplayName("Cancel by anyone but the creator is rejected")
    void testCancel_NotCreator() {
        assertThatThrownBy(() -> campaignService.cancelCampaign(STRANGER, 3L))
                .isInstanceOf(UnauthorizedCallerException.class);
    }

    @Test
    @DisplayName("End time of an under-goal all-or-nothing campaign cannot be moved once its deadline has passed")
    void testChangeEndTime_DeadlinePassedUnderGoal() {
        BalanceLedger ledger = BalanceLedger.empty(3L);
        ledger.setTotalDonations(BigInteger.valueOf(600));
        when(ledgerRepository.findById(3L)).thenReturn(Optional.of(ledger));
        Instant originalEnd = existing.getEndTime();
        clock.setInstant(originalEnd.plus(Duration.ofDays(1)));

        assertThatThrownBy(() -> campaignService.changeEndTime(CREATOR, 3L, originalEnd.plus(Duration.ofDays(6))))
                .isInstanceOf(InvalidCampaignStateException.class)
                .hasMessageContaining("FAILED");
        assertThat(existing.getEndTime()).isEqualTo(originalEnd);
        assertThat(existing.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
        verify(campaignRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Ended keep-what-you-raise campaign cannot be reopened by moving its end time")
    void testChangeEndTime_KeepWhatYouRaiseEnded() {
        existing.setFundingModel(FundingModel.KEEP_WHAT_YOU_RAISE);
        Instant originalEnd = existing.getEndTime();
        clock.setInstant(originalEnd.plusSeconds(60));

        assertThatThrownBy(() -> campaignService.changeEndTime(CREATOR, 3L, originalEnd.plus(Duration.ofDays(5))))
                .isInstanceOf(TemporalViolationException.class)
                .hasMessageContaining("campaign ended");
        assertThat(existing.getEndTime()).isEqualTo(originalEnd);
    }

    @Test
    @DisplayName("Details of an all-or-nothing campaign that already missed its goal are frozen")
    void testUpdateDetails_DeadlinePassedUnderGoal() {
        clock.setInstant(existing.getEndTime());

        assertThatThrownBy(() -> campaignService.updateCampaignDetails(CREATOR, 3L,
                new UpdateCampaignDetailsRequest("x", null, null, null)))
                .isInstanceOf(InvalidCampaignStateException.class)
                .hasMessageContaining("FAILED");
        assertThat(existing.getName()).isEqualTo("Linen shirts");
    }

    @Test
    @DisplayName("Cancel is refused for an all-or-nothing campaign that failed at its deadline without donations")
    void testCancel_DeadlinePassed() {
        clock.setInstant(existing.getEndTime().plus(Duration.ofDays(1)));

        assertThatThrownBy(() -> campaignService.cancelCampaign(CREATOR, 3L))
                .isInstanceOf(InvalidCampaignStateException.class)
                .hasMessageContaining("FAILED");
        assertThat(existing.getStatus()).isEqualTo(CampaignStatus.ACTIVE);
        verify(eventPublisher, never()).publishTransition(any());
    }

    private CreateCampaignRequest validRequest() {
        return request(NOW.plus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(30)), BigInteger.valueOf(1000));
    }

    private CreateCampaignRequest request(Instant start, Instant end, BigInteger goal) {
        return new CreateCampaignRequest(start, end, "Autumn knitwear", "Small batch run",
                "https://example.org", null, goal, FundingModel.ALL_OR_NOTHING, TOKEN);
    }
}
