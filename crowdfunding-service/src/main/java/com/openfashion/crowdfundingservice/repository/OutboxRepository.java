package com.openfashion.crowdfundingservice.repository;

import com.openfashion.crowdfundingservice.model.CampaignEventType;
import com.openfashion.crowdfundingservice.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

    @Query(value = """
    SELECT * FROM outbox_events
    WHERE status = 'PENDING'
    ORDER BY created_at
    LIMIT :limit
    FOR UPDATE SKIP LOCKED
    """, nativeQuery = true)
    List<OutboxEvent> findTopForProcessing(@Param("limit") int limit);

    List<OutboxEvent> findAllByAggregateIdOrderByCreatedAt(String aggregateId);

    long countByEventType(CampaignEventType eventType);
}
