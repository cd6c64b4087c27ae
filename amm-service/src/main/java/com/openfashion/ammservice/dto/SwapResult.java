package com.openfashion.ammservice.dto;

public record SwapResult(
        long swapId,
        long amountOut,
        long fee,
        long priceImpact
) {}
