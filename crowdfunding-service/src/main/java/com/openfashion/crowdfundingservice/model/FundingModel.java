package com.openfashion.crowdfundingservice.model;

public enum FundingModel {

    /**
     * Funds reach the creator only if the goal is met by the deadline.
     * Otherwise donors claim refunds net of the platform fee.
     */
    ALL_OR_NOTHING,

    /**
     * The creator withdraws whatever was raised once the deadline passes.
     * Donations are never refunded.
     */
    KEEP_WHAT_YOU_RAISE
}
