package com.openfashion.crowdfundingservice.controller;

import com.openfashion.crowdfundingservice.service.CampaignQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/participants")
public class ParticipantController {

    private final CampaignQueryService queryService;

    public ParticipantController(CampaignQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{address}/created-campaigns")
    public ResponseEntity<List<Long>> getCreatedCampaigns(@PathVariable String address) {
        return ResponseEntity.ok(queryService.getCreatedCampaigns(address));
    }

    @GetMapping("/{address}/donated-campaigns")
    public ResponseEntity<List<Long>> getDonatedCampaigns(@PathVariable String address) {
        return ResponseEntity.ok(queryService.getDonatedCampaigns(address));
    }
}
