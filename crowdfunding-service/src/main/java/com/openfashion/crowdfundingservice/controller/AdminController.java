package com.openfashion.crowdfundingservice.controller;

import com.openfashion.crowdfundingservice.core.annotation.CampaignLocked;
import com.openfashion.crowdfundingservice.dto.EmergencyWithdrawRequest;
import com.openfashion.crowdfundingservice.dto.FeeRateRequest;
import com.openfashion.crowdfundingservice.dto.response.FeeCollectionResult;
import com.openfashion.crowdfundingservice.dto.response.FundsTransferResponse;
import com.openfashion.crowdfundingservice.dto.response.PlatformOverviewResponse;
import com.openfashion.crowdfundingservice.service.CampaignQueryService;
import com.openfashion.crowdfundingservice.service.PlatformAdminService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.openfashion.crowdfundingservice.controller.CampaignController.CALLER_HEADER;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private final PlatformAdminService adminService;
    private final CampaignQueryService queryService;

    public AdminController(PlatformAdminService adminService, CampaignQueryService queryService) {
        this.adminService = adminService;
        this.queryService = queryService;
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.pause(caller);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/unpause")
    public ResponseEntity<Void> unpause(@RequestHeader(CALLER_HEADER) String caller) {
        adminService.unpause(caller);
        return ResponseEntity.noContent().build();
    }

    @CampaignLocked
    @PostMapping("/campaigns/{campaignId}/dispute")
    public ResponseEntity<Void> flagDispute(@RequestHeader(CALLER_HEADER) String caller,
                                            @PathVariable Long campaignId) {
        adminService.flagCampaignAsDisputed(caller, campaignId);
        return ResponseEntity.noContent().build();
    }

    @CampaignLocked
    @PostMapping("/campaigns/{campaignId}/dispute/resolution")
    public ResponseEntity<Void> resolveDispute(@RequestHeader(CALLER_HEADER) String caller,
                                               @PathVariable Long campaignId,
                                               @RequestParam boolean favorCreator) {
        adminService.resolveDispute(caller, campaignId, favorCreator);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/fee-rate")
    public ResponseEntity<Void> setFeeRate(@RequestHeader(CALLER_HEADER) String caller,
                                           @Valid @RequestBody FeeRateRequest request) {
        adminService.setPlatformFeeRate(caller, request.feeRateBps());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/fees/{token}/collect")
    public ResponseEntity<FeeCollectionResult> collectFees(@RequestHeader(CALLER_HEADER) String caller,
                                                           @PathVariable String token) {
        return ResponseEntity.ok(adminService.collectPlatformFees(caller, token));
    }

    @PostMapping("/emergency-withdrawals")
    public ResponseEntity<FundsTransferResponse> emergencyWithdraw(@RequestHeader(CALLER_HEADER) String caller,
                                                                   @Valid @RequestBody EmergencyWithdrawRequest request) {
        return ResponseEntity.ok(adminService.emergencyWithdraw(caller, request.token(), request.amount()));
    }

    @GetMapping("/settings")
    public ResponseEntity<PlatformOverviewResponse> getSettings() {
        return ResponseEntity.ok(queryService.getPlatformOverview());
    }
}
