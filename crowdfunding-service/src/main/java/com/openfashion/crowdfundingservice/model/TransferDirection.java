package com.openfashion.crowdfundingservice.model;

public enum TransferDirection {
    INBOUND, // Pulled from a donor into custody
    OUTBOUND // Pushed out of custody
}
