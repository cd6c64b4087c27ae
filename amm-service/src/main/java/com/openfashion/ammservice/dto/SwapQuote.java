package com.openfashion.ammservice.dto;

public record SwapQuote(
        long amountOut,
        long fee,
        long priceImpact
) {}
