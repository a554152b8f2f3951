package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.DonorRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DonorRecordRepository extends JpaRepository<DonorRecord, Long> {

    Optional<DonorRecord> findByDonorAndCampaignId(String donor, Long campaignId);

    @Query("SELECT d.donor FROM DonorRecord d WHERE d.campaignId = :campaignId ORDER BY d.id")
    List<String> findDonorsByCampaignId(@Param("campaignId") Long campaignId);

    @Query("SELECT d.campaignId FROM DonorRecord d WHERE d.donor = :donor ORDER BY d.id")
    List<Long> findCampaignIdsByDonor(@Param("donor") String donor);

    long countByCampaignId(Long campaignId);
}
