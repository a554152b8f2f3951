package com.openfashion.crowdfundingservice.controller;

import com.openfashion.crowdfundingservice.core.annotation.CampaignLocked;
import com.openfashion.crowdfundingservice.dto.ChangeEndTimeRequest;
import com.openfashion.crowdfundingservice.dto.CreateCampaignRequest;
import com.openfashion.crowdfundingservice.dto.DonationRequest;
import com.openfashion.crowdfundingservice.dto.UpdateCampaignDetailsRequest;
import com.openfashion.crowdfundingservice.dto.response.*;
import com.openfashion.crowdfundingservice.service.CampaignQueryService;
import com.openfashion.crowdfundingservice.service.CampaignService;
import com.openfashion.crowdfundingservice.service.FundingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/campaigns")
public class CampaignController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final CampaignService campaignService;
    private final FundingService fundingService;
    private final CampaignQueryService queryService;

    public CampaignController(CampaignService campaignService, FundingService fundingService, CampaignQueryService queryService) {
        this.campaignService = campaignService;
        this.fundingService = fundingService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<CampaignCreatedResponse> createCampaign(@RequestHeader(CALLER_HEADER) String caller,
                                                                  @Valid @RequestBody CreateCampaignRequest request) {
        long campaignId = campaignService.createCampaign(caller, request);
        return new ResponseEntity<>(new CampaignCreatedResponse(campaignId), HttpStatus.CREATED);
    }

    @CampaignLocked
    @PutMapping("/{campaignId}/details")
    public ResponseEntity<Void> updateDetails(@RequestHeader(CALLER_HEADER) String caller,
                                              @PathVariable Long campaignId,
                                              @Valid @RequestBody UpdateCampaignDetailsRequest request) {
        campaignService.updateCampaignDetails(caller, campaignId, request);
        return ResponseEntity.noContent().build();
    }

    @CampaignLocked
    @PutMapping("/{campaignId}/end-time")
    public ResponseEntity<Void> changeEndTime(@RequestHeader(CALLER_HEADER) String caller,
                                              @PathVariable Long campaignId,
                                              @Valid @RequestBody ChangeEndTimeRequest request) {
        campaignService.changeEndTime(caller, campaignId, request.endTime());
        return ResponseEntity.noContent().build();
    }

    @CampaignLocked
    @PostMapping("/{campaignId}/cancel")
    public ResponseEntity<Void> cancelCampaign(@RequestHeader(CALLER_HEADER) String caller,
                                               @PathVariable Long campaignId) {
        campaignService.cancelCampaign(caller, campaignId);
        return ResponseEntity.noContent().build();
    }

    @CampaignLocked
    @PostMapping("/{campaignId}/donations")
    public ResponseEntity<DonationReceipt> donate(@RequestHeader(CALLER_HEADER) String caller,
                                                  @PathVariable Long campaignId,
                                                  @Valid @RequestBody DonationRequest request) {
        return new ResponseEntity<>(fundingService.donate(caller, campaignId, request.amount()), HttpStatus.CREATED);
    }

    @CampaignLocked
    @PostMapping("/{campaignId}/refunds")
    public ResponseEntity<FundsTransferResponse> claimRefund(@RequestHeader(CALLER_HEADER) String caller,
                                                             @PathVariable Long campaignId) {
        return ResponseEntity.ok(fundingService.claimRefund(caller, campaignId));
    }

    @CampaignLocked
    @PostMapping("/{campaignId}/withdrawals")
    public ResponseEntity<FundsTransferResponse> withdrawFunds(@RequestHeader(CALLER_HEADER) String caller,
                                                               @PathVariable Long campaignId) {
        return ResponseEntity.ok(fundingService.withdrawFunds(caller, campaignId));
    }

    @GetMapping("/{campaignId}")
    public ResponseEntity<CampaignResponse> getCampaign(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getCampaign(campaignId));
    }

    @GetMapping("/{campaignId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getBalance(campaignId));
    }

    @GetMapping("/{campaignId}/progress")
    public ResponseEntity<FundingProgressResponse> getFundingProgress(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getFundingProgress(campaignId));
    }

    @GetMapping("/{campaignId}/outcome")
    public ResponseEntity<CampaignOutcomeResponse> getOutcome(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getOutcome(campaignId));
    }

    @GetMapping("/{campaignId}/info")
    public ResponseEntity<CampaignInfoResponse> getCampaignInfo(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getCampaignInfo(campaignId));
    }

    @GetMapping("/{campaignId}/donors")
    public ResponseEntity<List<String>> getDonors(@PathVariable Long campaignId) {
        return ResponseEntity.ok(queryService.getDonors(campaignId));
    }

    @GetMapping("/{campaignId}/donors/{donor}")
    public ResponseEntity<DonorResponse> getDonor(@PathVariable Long campaignId, @PathVariable String donor) {
        return ResponseEntity.ok(queryService.getDonor(campaignId, donor));
    }
}
