package com.openfashion.lendingservice.dto;

public record ProtocolStats(
        long totalDeposited,
        long totalBorrowed,
        long loanCount
) {}
