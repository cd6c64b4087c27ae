package com.openfashion.lendingservice.service.imp;

import com.openfashion.lendingservice.model.OutboxEvent;
import com.openfashion.lendingservice.model.OutboxStatus;
import com.openfashion.lendingservice.repository.OutboxRepository;
import com.openfashion.lendingservice.service.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class OutboxServiceImp implements OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void record(String eventType, String aggregateId, Object payload) {
        try {
            String jsonPayload = objectMapper.writeValueAsString(payload);

            OutboxEvent outboxEvent = OutboxEvent.builder()
                    .aggregateId(aggregateId)
                    .eventType(eventType)
                    .payload(jsonPayload)
                    .status(OutboxStatus.PENDING)
                    .createdAt(Instant.now())
                    .build();

            outboxRepository.save(outboxEvent);
        } catch (JacksonException e) {
            log.error("Failed to serialize {} event for outbox", eventType, e);
            throw new SerializationFailedException("Serialization failure", e);
        }
    }
}
