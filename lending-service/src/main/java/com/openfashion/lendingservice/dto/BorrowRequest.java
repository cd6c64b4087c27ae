package com.openfashion.lendingservice.dto;

public record BorrowRequest(
        long amount,
        long collateralAmount
) {}
