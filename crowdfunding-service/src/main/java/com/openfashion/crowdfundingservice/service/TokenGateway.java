package com.openfashion.crowdfundingservice.service;

import java.math.BigInteger;

/**
 * Movement of fungible tokens in and out of platform custody.
 * <p>
 * Each call either moves the full amount or throws, failing the surrounding transaction.
 */
public interface TokenGateway {

    boolean isContract(String token);

    void pull(String token, String from, BigInteger amount);

    void push(String token, String to, BigInteger amount);
}
