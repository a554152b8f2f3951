package com.openfashion.crowdfundingservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openfashion.crowdfundingservice.dto.event.CampaignEvent;
import com.openfashion.crowdfundingservice.model.CampaignEventType;
import com.openfashion.crowdfundingservice.model.OutboxEvent;
import com.openfashion.crowdfundingservice.model.OutboxStatus;
import com.openfashion.crowdfundingservice.repository.OutboxRepository;
import com.openfashion.crowdfundingservice.service.lifecycle.StatusTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes campaign events to the transactional outbox. Rows commit or roll back together with the
 * state change that produced them; {@code OutboxPoller} ships them to Kafka.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CampaignEventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void publish(CampaignEventType eventType, Object aggregateId, Map<String, Object> details) {
        Instant now = clock.instant();
        CampaignEvent event = new CampaignEvent(eventType, String.valueOf(aggregateId), now, new LinkedHashMap<>(details));

        try {
            String jsonPayload = objectMapper.writeValueAsString(event);

            OutboxEvent outboxEvent = OutboxEvent.builder()
                    .aggregateId(event.aggregateId())
                    .eventType(eventType)
                    .payload(jsonPayload)
                    .status(OutboxStatus.PENDING)
                    .createdAt(now)
                    .build();

            outboxRepository.save(outboxEvent);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for outbox", eventType, e);
            throw new SerializationFailedException("Serialization failure", e);
        }
    }

    public void publishTransition(StatusTransition transition) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", transition.from());
        details.put("to", transition.to());
        publish(CampaignEventType.CAMPAIGN_STATUS_CHANGED, transition.campaignId(), details);
    }
}
