package com.openfashion.ammservice.dto;

import jakarta.validation.constraints.NotBlank;

public record SwapRequest(
        long poolId,
        long amountIn,
        long minAmountOut,
        @NotBlank String assetIn
) {}
