package com.openfashion.ammservice.dto;

import com.openfashion.ammservice.model.SwapRecord;

public record SwapDetails(
        long swapId,
        long poolId,
        String trader,
        String assetIn,
        String assetOut,
        long amountIn,
        long amountOut,
        long feePaid,
        long priceImpact,
        long blockHeight
) {

    public static SwapDetails from(SwapRecord swap) {
        return new SwapDetails(
                swap.getId(),
                swap.getPoolId(),
                swap.getTrader(),
                swap.getAssetIn(),
                swap.getAssetOut(),
                swap.getAmountIn(),
                swap.getAmountOut(),
                swap.getFeePaid(),
                swap.getPriceImpact(),
                swap.getBlockHeight()
        );
    }
}
