package com.openfashion.ammservice.dto.event;

public record PoolCreatedEvent(
        long poolId,
        String creator,
        String assetA,
        String assetB,
        long amountA,
        long amountB,
        long liquidity,
        long block
) {}
