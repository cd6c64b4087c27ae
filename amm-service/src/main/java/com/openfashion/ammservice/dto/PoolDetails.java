package com.openfashion.ammservice.dto;

import com.openfashion.ammservice.model.LiquidityPool;

public record PoolDetails(
        long poolId,
        String assetA,
        String assetB,
        long reserveA,
        long reserveB,
        long totalSupply,
        long feeRate,
        long lastPriceA,
        long lastPriceB,
        long createdAtBlock,
        boolean active
) {

    public static PoolDetails from(LiquidityPool pool) {
        return new PoolDetails(
                pool.getId(),
                pool.getAssetA(),
                pool.getAssetB(),
                pool.getReserveA(),
                pool.getReserveB(),
                pool.getTotalSupply(),
                pool.getFeeRate(),
                pool.getLastPriceA(),
                pool.getLastPriceB(),
                pool.getCreatedAtBlock(),
                pool.isActive()
        );
    }
}
