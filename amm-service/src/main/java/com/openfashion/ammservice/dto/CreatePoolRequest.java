package com.openfashion.ammservice.dto;

import jakarta.validation.constraints.NotBlank;

public record CreatePoolRequest(
        @NotBlank String assetA,
        @NotBlank String assetB,
        long amountA,
        long amountB
) {}
