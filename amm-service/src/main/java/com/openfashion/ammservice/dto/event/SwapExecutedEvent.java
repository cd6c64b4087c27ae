package com.openfashion.ammservice.dto.event;

public record SwapExecutedEvent(
        long swapId,
        long poolId,
        String trader,
        String assetIn,
        String assetOut,
        long amountIn,
        long amountOut,
        long fee,
        long priceImpact,
        long block
) {}
