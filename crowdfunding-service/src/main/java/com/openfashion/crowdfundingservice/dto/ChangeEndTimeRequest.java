package com.openfashion.crowdfundingservice.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record ChangeEndTimeRequest(
        @NotNull(message = "New end time is required")
        Instant endTime
) {}
