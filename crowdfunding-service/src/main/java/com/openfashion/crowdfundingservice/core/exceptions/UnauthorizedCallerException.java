package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class UnauthorizedCallerException extends RuntimeException {
    public UnauthorizedCallerException(String caller, String requiredRole) {
        super("Caller " + caller + " is not " + requiredRole);
    }

    public UnauthorizedCallerException(String caller, Long campaignId) {
        super("Caller " + caller + " is not the creator of campaign " + campaignId);
    }
}
