package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class ConservationViolationException extends RuntimeException {
    public ConservationViolationException(String message) {
        super(message);
    }
}
