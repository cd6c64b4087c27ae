package com.openfashion.ammservice.client.settlement.dto;

import java.util.UUID;

public record SettlementResponse(
        UUID transferId,
        SettlementStatus status,
        String reasonCode
) {
}
