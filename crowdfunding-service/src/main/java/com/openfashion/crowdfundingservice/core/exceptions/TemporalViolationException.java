package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class TemporalViolationException extends RuntimeException {
    public TemporalViolationException(Long campaignId, String reason, Instant now, Instant boundary) {
        super("Campaign " + campaignId + ": " + reason + " (now " + now + ", boundary " + boundary + ")");
    }
}
