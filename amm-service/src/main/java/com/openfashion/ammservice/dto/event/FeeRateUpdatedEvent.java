package com.openfashion.ammservice.dto.event;

public record FeeRateUpdatedEvent(
        long poolId,
        long previousFeeRate,
        long feeRate,
        long block
) {}
