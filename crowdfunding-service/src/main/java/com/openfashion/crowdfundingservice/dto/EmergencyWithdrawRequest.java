package com.openfashion.crowdfundingservice.dto;

import com.openfashion.crowdfundingservice.core.util.Addresses;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

public record EmergencyWithdrawRequest(
        @NotNull @Pattern(regexp = Addresses.PATTERN, message = "Token must be a 20-byte hex address") String token,
        @NotNull @Positive BigInteger amount
) {}
