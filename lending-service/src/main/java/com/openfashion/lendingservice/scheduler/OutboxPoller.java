package com.openfashion.lendingservice.scheduler;

import com.openfashion.lendingservice.model.OutboxEvent;
import com.openfashion.lendingservice.model.OutboxStatus;
import com.openfashion.lendingservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private static final String BALANCE_TOPIC = "lending.balances";
    private static final String LOAN_TOPIC = "lending.loans";
    private static final int DELAY = 2000;
    private static final int LIMIT = 100;

    @Scheduled(fixedDelay = DELAY)
    @Transactional
    public void processOutboxEvent() {
        List<OutboxEvent> events = outboxRepository.findTopForProcessing(LIMIT);

        if (events.isEmpty()) return;

        log.info("Polling outbox: found {} events to publish", events.size());

        for (OutboxEvent event : events) {
            try {
                String targetTopic = determineTopic(event.getEventType());

                kafkaTemplate.send(targetTopic, event.getAggregateId(), event.getPayload())
                        .get(3, TimeUnit.SECONDS);

                event.setStatus(OutboxStatus.PROCESSED);
                outboxRepository.save(event);

                log.debug("Published event {} ({}) to topic {}", event.getId(), event.getEventType(), targetTopic);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Thread was interrupted while sending event {}", event.getId());
                return;
            } catch (ExecutionException | TimeoutException e) {
                log.error("Failed to publish outbox event {}: {}", event.getId(), e.getMessage());
            }
        }
    }

    static String determineTopic(String eventType) {
        return switch (eventType) {
            case "DEPOSIT", "WITHDRAWAL" -> BALANCE_TOPIC;
            case "LOAN_CREATED", "LOAN_REPAID", "LOAN_LIQUIDATED" -> LOAN_TOPIC;
            default -> "lending.unknown";
        };
    }
}
