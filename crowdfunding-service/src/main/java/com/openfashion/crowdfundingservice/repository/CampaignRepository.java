package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.Campaign;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Campaign c WHERE c.id = :id")
    Optional<Campaign> findForUpdate(@Param("id") Long id);

    @Query("SELECT c.id FROM Campaign c WHERE c.creator = :creator ORDER BY c.id")
    List<Long> findIdsByCreator(@Param("creator") String creator);

    List<Campaign> findAllByTokenOrderByIdAsc(String token);
}
