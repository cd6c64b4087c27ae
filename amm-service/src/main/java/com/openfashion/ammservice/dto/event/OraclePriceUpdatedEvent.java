package com.openfashion.ammservice.dto.event;

public record OraclePriceUpdatedEvent(
        String asset,
        long price,
        long block
) {}
