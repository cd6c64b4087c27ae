package com.openfashion.lendingservice.dto.event;

public record BalanceChangedEvent(
        String accountId,
        long amount,
        long balance,
        long block
) {}
