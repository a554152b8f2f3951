package com.openfashion.crowdfundingservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateCampaignDetailsRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 4000) String description,
        @Size(max = 255) String url,
        @Size(max = 255) String imageUrl
) {
}
