package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidCampaignStateException extends RuntimeException {
    public InvalidCampaignStateException(Long campaignId, String reason) {
        super("Campaign " + campaignId + ": " + reason);
    }
}
