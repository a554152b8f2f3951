package com.openfashion.crowdfundingservice.dto;

import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.model.FundingModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigInteger;
import java.time.Instant;

public record CreateCampaignRequest(
        @NotNull Instant startTime,
        @NotNull Instant endTime,
        @NotBlank @Size(max = 255) String name,
        @Size(max = 4000) String description,
        @Size(max = 255) String url,
        @Size(max = 255) String imageUrl,
        @NotNull @Positive BigInteger fundingGoal,
        @NotNull FundingModel fundingModel,
        @NotNull @Pattern(regexp = Addresses.PATTERN, message = "Token must be a 20-byte hex address") String token
) {
}
