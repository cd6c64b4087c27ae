package com.openfashion.ammservice.dto.event;

public record LiquidityChangedEvent(
        long poolId,
        String provider,
        long shares,
        long amountA,
        long amountB,
        long totalSupply,
        long block
) {}
