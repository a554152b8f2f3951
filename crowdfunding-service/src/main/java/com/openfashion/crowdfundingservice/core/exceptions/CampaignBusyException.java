package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CampaignBusyException extends RuntimeException {
    public CampaignBusyException(Long campaignId) {
        super("Another request is in progress for campaign: " + campaignId);
    }
}
