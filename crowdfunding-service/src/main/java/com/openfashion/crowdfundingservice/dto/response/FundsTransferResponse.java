package com.openfashion.crowdfundingservice.dto.response;

import java.math.BigInteger;

public record FundsTransferResponse(
        Long campaignId,
        String recipient,
        String token,
        BigInteger amount
) {}
