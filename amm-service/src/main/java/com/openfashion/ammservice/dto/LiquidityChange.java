package com.openfashion.ammservice.dto;

/**
 * Outcome of adding or removing liquidity: shares minted or burned and the asset amounts moved.
 */
public record LiquidityChange(
        long poolId,
        long shares,
        long amountA,
        long amountB
) {}
