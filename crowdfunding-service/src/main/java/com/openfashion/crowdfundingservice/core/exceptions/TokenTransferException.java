package com.openfashion.crowdfundingservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigInteger;

@ResponseStatus(HttpStatus.CONFLICT)
public class TokenTransferException extends RuntimeException {
    public TokenTransferException(String token, BigInteger amount, String reason) {
        super("Transfer of " + amount + " " + token + " failed: " + reason);
    }
}
