package com.openfashion.crowdfundingservice;

import com.openfashion.crowdfundingservice.controller.AdminController;
import com.openfashion.crowdfundingservice.controller.CampaignController;
import com.openfashion.crowdfundingservice.core.config.GlobalExceptionHandler;
import com.openfashion.crowdfundingservice.core.exceptions.SystemNotPausedException;
import com.openfashion.crowdfundingservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.crowdfundingservice.dto.response.FeeCollectionResult;
import com.openfashion.crowdfundingservice.dto.response.PlatformOverviewResponse;
import com.openfashion.crowdfundingservice.service.CampaignQueryService;
import com.openfashion.crowdfundingservice.service.PlatformAdminService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdminControllerTest {

    private static final String ADMIN = "0x00000000000000000000000000000000000000ad";
    private static final String TOKEN = "0x00000000000000000000000000000000000000c0";

    @Mock
    private PlatformAdminService adminService;
    @Mock
    private CampaignQueryService queryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AdminController(adminService, queryService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /admin/pause - Success returns 204")
    void testPause() throws Exception {
        mockMvc.perform(post("/admin/pause").header(CampaignController.CALLER_HEADER, ADMIN))
                .andExpect(status().isNoContent());

        verify(adminService).pause(ADMIN);
    }

    @Test
    @DisplayName("POST /admin/campaigns/{id}/dispute/resolution - Passes the verdict through")
    void testResolveDispute() throws Exception {
        mockMvc.perform(post("/admin/campaigns/3/dispute/resolution")
                        .header(CampaignController.CALLER_HEADER, ADMIN)
                        .param("favorCreator", "false"))
                .andExpect(status().isNoContent());

        verify(adminService).resolveDispute(ADMIN, 3L, false);
    }

    @Test
    @DisplayName("PUT /admin/fee-rate - Non-owner returns 403")
    void testSetFeeRate_Unauthorized() throws Exception {
        doThrow(new UnauthorizedCallerException(ADMIN, "the platform owner"))
                .when(adminService).setPlatformFeeRate(ADMIN, 250);

        mockMvc.perform(put("/admin/fee-rate")
                        .header(CampaignController.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feeRateBps\": 250}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("PUT /admin/fee-rate - Rate above 10000 bps returns 400")
    void testSetFeeRate_OutOfRange() throws Exception {
        mockMvc.perform(put("/admin/fee-rate")
                        .header(CampaignController.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feeRateBps\": 10001}"))
                .andExpect(status().isBadRequest());

        verify(adminService, never()).setPlatformFeeRate(anyString(), anyInt());
    }

    @Test
    @DisplayName("POST /admin/fees/{token}/collect - Returns the swept amount")
    void testCollectFees() throws Exception {
        when(adminService.collectPlatformFees(ADMIN, TOKEN))
                .thenReturn(new FeeCollectionResult(TOKEN, ADMIN, BigInteger.valueOf(15), 2));

        mockMvc.perform(post("/admin/fees/" + TOKEN + "/collect").header(CampaignController.CALLER_HEADER, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(15))
                .andExpect(jsonPath("$.campaignsSwept").value(2));
    }

    @Test
    @DisplayName("POST /admin/emergency-withdrawals - Running system returns 409")
    void testEmergencyWithdraw_NotPaused() throws Exception {
        when(adminService.emergencyWithdraw(ADMIN, TOKEN, BigInteger.TEN))
                .thenThrow(new SystemNotPausedException("emergencyWithdraw"));

        mockMvc.perform(post("/admin/emergency-withdrawals")
                        .header(CampaignController.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"%s\", \"amount\": 10}".formatted(TOKEN)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SYSTEM_NOT_PAUSED"));
    }

    @Test
    @DisplayName("GET /admin/settings - Returns the platform overview")
    void testGetSettings() throws Exception {
        when(queryService.getPlatformOverview())
                .thenReturn(new PlatformOverviewResponse(4, 100, false, Map.of(TOKEN, BigInteger.valueOf(15))));

        mockMvc.perform(get("/admin/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latestCampaignId").value(4))
                .andExpect(jsonPath("$.platformFeeRateBps").value(100));
    }
}
