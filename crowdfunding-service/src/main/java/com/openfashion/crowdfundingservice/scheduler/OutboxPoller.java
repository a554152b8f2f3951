package com.openfashion.crowdfundingservice.scheduler;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.model.OutboxEvent;
import com.openfashion.crowdfundingservice.model.OutboxStatus;
import com.openfashion.crowdfundingservice.repository.OutboxRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays pending outbox rows to their Kafka topic in creation order. A row that keeps failing is
 * retried on later polls until it reaches {@code crowdfunding.outbox.max-attempts}, then parked as FAILED
 * with the last broker error so it no longer blocks the batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final int DELAY = 2000;
    private static final long SEND_TIMEOUT_SECONDS = 3;

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final CrowdfundingProperties properties;

    @Scheduled(fixedDelay = DELAY)
    @Transactional
    public void processOutboxEvent() {
        CrowdfundingProperties.Outbox settings = properties.getOutbox();
        List<OutboxEvent> events = outboxRepository.findTopForProcessing(settings.getBatchSize());
        if (events.isEmpty()) return;

        log.debug("Relaying {} outbox events", events.size());

        for (OutboxEvent event : events) {
            String topic = event.getEventType().topic();
            try {
                kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                        .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                event.setStatus(OutboxStatus.PROCESSED);
                log.debug("Relayed {} for {} to {}", event.getEventType(), event.getAggregateId(), topic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while relaying outbox event {}", event.getId());
                return;
            } catch (ExecutionException e) {
                fail(event, topic, String.valueOf(e.getCause()), settings.getMaxAttempts());
            } catch (TimeoutException e) {
                fail(event, topic, "no broker ack within " + SEND_TIMEOUT_SECONDS + "s", settings.getMaxAttempts());
            }
            outboxRepository.save(event);
        }
    }

    private void fail(OutboxEvent event, String topic, String error, int maxAttempts) {
        event.recordFailure(error, maxAttempts);
        if (event.getStatus() == OutboxStatus.FAILED) {
            log.error("Giving up on outbox event {} ({}) after {} attempts: {}",
                    event.getId(), event.getEventType(), event.getAttempts(), error);
        } else {
            log.warn("Attempt {} to relay outbox event {} to {} failed: {}",
                    event.getAttempts(), event.getId(), topic, error);
        }
    }
}
