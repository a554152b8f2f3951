package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.BalanceLedger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BalanceLedgerRepository extends JpaRepository<BalanceLedger, Long> {

    List<BalanceLedger> findAllByCampaignIdIn(Collection<Long> campaignIds);
}
