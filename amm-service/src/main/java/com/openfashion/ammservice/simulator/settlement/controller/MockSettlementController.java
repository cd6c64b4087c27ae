package com.openfashion.ammservice.simulator.settlement.controller;

import com.openfashion.ammservice.client.settlement.dto.SettlementRequest;
import com.openfashion.ammservice.client.settlement.dto.SettlementResponse;
import com.openfashion.ammservice.client.settlement.dto.SettlementStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@RestController
@RequestMapping("/mock-settlement")
@Profile({"dev", "test"})
@Slf4j
public class MockSettlementController {

    private final Map<UUID, SettlementResponse> idempotencyStore = new ConcurrentHashMap<>();

    @PostMapping("/transfers")
    public SettlementResponse simulateTransfer(@RequestBody SettlementRequest request) {
        return idempotencyStore.computeIfAbsent(request.referenceId(), id -> {
            if (request.amount() <= 0 || request.asset() == null || request.from() == null || request.to() == null) {
                log.info("Mock settlement: declining malformed transfer {}", id);
                return new SettlementResponse(UUID.randomUUID(), SettlementStatus.DECLINED, "MALFORMED_TRANSFER");
            }
            return new SettlementResponse(UUID.randomUUID(), SettlementStatus.APPROVED, "SUCCESS");
        });
    }

}
