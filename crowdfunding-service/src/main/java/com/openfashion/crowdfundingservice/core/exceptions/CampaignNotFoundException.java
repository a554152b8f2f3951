package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CampaignNotFoundException extends RuntimeException {
    public CampaignNotFoundException(Long campaignId) {
        super("Cannot find campaign: " + campaignId);
    }
}
