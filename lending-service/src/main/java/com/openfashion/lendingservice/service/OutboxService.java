package com.openfashion.lendingservice.service;

public interface OutboxService {

    /**
     * Stores the event in the outbox inside the caller's transaction.
     */
    void record(String eventType, String aggregateId, Object payload);
}
