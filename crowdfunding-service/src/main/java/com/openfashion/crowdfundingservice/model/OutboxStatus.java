package com.openfashion.crowdfundingservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED,
    // Gave up after the configured number of publish attempts
    FAILED
}
