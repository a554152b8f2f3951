package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String field, Object value, String reason) {
        super("Invalid " + field + " '" + value + "': " + reason);
    }
}
