package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SystemNotPausedException extends RuntimeException {
    public SystemNotPausedException(String operation) {
        super("System must be paused for: " + operation);
    }
}
