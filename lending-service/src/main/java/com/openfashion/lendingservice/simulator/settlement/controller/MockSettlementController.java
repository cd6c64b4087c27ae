package com.openfashion.lendingservice.simulator.settlement.controller;

import com.openfashion.lendingservice.client.settlement.dto.SettlementRequest;
import com.openfashion.lendingservice.client.settlement.dto.SettlementResponse;
import com.openfashion.lendingservice.client.settlement.dto.SettlementStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stand-in for the settlement layer in local runs: approves every well-formed transfer.
 */
@RestController
@RequestMapping("/mock-settlement")
@Profile({"dev", "test"})
@Slf4j
public class MockSettlementController {

    private final Map<UUID, SettlementResponse> idempotencyStore = new ConcurrentHashMap<>();

    @PostMapping("/transfers")
    public SettlementResponse simulateTransfer(@RequestBody SettlementRequest request) {

        SettlementResponse cached = idempotencyStore.get(request.referenceId());
        if (cached != null) {
            log.info("Mock settlement: returning cached response for {}", request.referenceId());
            return cached;
        }

        SettlementResponse response;
        if (request.amount() <= 0 || request.from() == null || request.to() == null) {
            response = new SettlementResponse(UUID.randomUUID(), SettlementStatus.DECLINED, "MALFORMED_TRANSFER");
        } else {
            response = new SettlementResponse(UUID.randomUUID(), SettlementStatus.APPROVED, "SUCCESS");
        }

        idempotencyStore.put(request.referenceId(), response);
        return response;
    }

}
