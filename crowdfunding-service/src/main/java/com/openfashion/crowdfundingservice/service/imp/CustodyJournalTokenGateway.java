package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.core.exceptions.TokenTransferException;
import com.openfashion.crowdfundingservice.core.util.Addresses;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import com.openfashion.crowdfundingservice.model.CustodyTransfer;
import com.openfashion.crowdfundingservice.model.TokenCustodyAccount;
import com.openfashion.crowdfundingservice.model.TransferDirection;
import com.openfashion.crowdfundingservice.repository.CustodyTransferRepository;
import com.openfashion.crowdfundingservice.repository.TokenCustodyAccountRepository;
import com.openfashion.crowdfundingservice.service.TokenGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps custody balances per token and journals every movement. Runs inside the caller's
 * transaction so a failed entry point leaves no trace in custody either.
 */
@Service
@Slf4j
public class CustodyJournalTokenGateway implements TokenGateway {

    private final TokenCustodyAccountRepository custodyRepository;
    private final CustodyTransferRepository transferRepository;
    private final Set<String> contracts;

    public CustodyJournalTokenGateway(TokenCustodyAccountRepository custodyRepository,
                                      CustodyTransferRepository transferRepository,
                                      CrowdfundingProperties properties) {
        this.custodyRepository = custodyRepository;
        this.transferRepository = transferRepository;
        this.contracts = properties.getTokens().getContracts().stream()
                .map(t -> Addresses.normalize("crowdfunding.tokens.contracts", t))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isContract(String token) {
        return token != null && contracts.contains(token.toLowerCase(Locale.ROOT));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pull(String token, String from, BigInteger amount) {
        requireTransferable(token, amount);

        TokenCustodyAccount account = custodyRepository.findById(token)
                .orElseGet(() -> new TokenCustodyAccount(token));
        account.setBalance(TokenMath.add(account.getBalance(), amount));
        custodyRepository.save(account);

        journal(token, from, amount, TransferDirection.INBOUND);
        log.debug("Pulled {} {} from {}", amount, token, from);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void push(String token, String to, BigInteger amount) {
        requireTransferable(token, amount);

        TokenCustodyAccount account = custodyRepository.findById(token)
                .orElseThrow(() -> new TokenTransferException(token, amount, "nothing held in custody"));

        if (account.getBalance().compareTo(amount) < 0) {
            throw new TokenTransferException(token, amount, "custody holds only " + account.getBalance());
        }
        account.setBalance(TokenMath.sub(account.getBalance(), amount));
        custodyRepository.save(account);

        journal(token, to, amount, TransferDirection.OUTBOUND);
        log.debug("Pushed {} {} to {}", amount, token, to);
    }

    private void requireTransferable(String token, BigInteger amount) {
        if (!isContract(token)) {
            throw new TokenTransferException(token, amount, "unknown token contract");
        }
        if (!TokenMath.isPositive(amount)) {
            throw new TokenTransferException(token, amount, "amount must be positive");
        }
    }

    private void journal(String token, String counterparty, BigInteger amount, TransferDirection direction) {
        transferRepository.save(CustodyTransfer.builder()
                .token(token)
                .counterparty(counterparty)
                .amount(amount)
                .direction(direction)
                .build());
    }
}
