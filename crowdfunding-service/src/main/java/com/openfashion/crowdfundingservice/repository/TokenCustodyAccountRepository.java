package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.TokenCustodyAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TokenCustodyAccountRepository extends JpaRepository<TokenCustodyAccount, String> {
}
