package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.CollectedFeeTotal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CollectedFeeTotalRepository extends JpaRepository<CollectedFeeTotal, String> {
}
