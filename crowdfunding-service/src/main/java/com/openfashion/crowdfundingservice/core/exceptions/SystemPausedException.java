package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class SystemPausedException extends RuntimeException {
    public SystemPausedException(String operation) {
        super("System is paused, rejected: " + operation);
    }
}
