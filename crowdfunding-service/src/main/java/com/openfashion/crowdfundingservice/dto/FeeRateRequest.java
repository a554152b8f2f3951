package com.openfashion.crowdfundingservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record FeeRateRequest(
        @NotNull @Min(0) @Max(10_000) Integer feeRateBps
) {}
