package com.openfashion.ammservice.dto;

public record AddLiquidityRequest(
        long amountA,
        long amountB,
        long minLiquidity
) {}
