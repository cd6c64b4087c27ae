package com.openfashion.lendingservice.client.settlement.dto;

import java.util.UUID;

public record SettlementRequest(
        UUID referenceId,
        String asset,
        long amount,
        String from,
        String to
) {}
