package com.openfashion.ammservice.dto;

public record RemoveLiquidityRequest(
        long liquidity,
        long minAmountA,
        long minAmountB
) {}
