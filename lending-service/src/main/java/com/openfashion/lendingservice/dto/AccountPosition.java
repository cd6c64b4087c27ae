package com.openfashion.lendingservice.dto;

public record AccountPosition(
        String accountId,
        long deposited,
        long borrowed,
        long collateral
) {}
