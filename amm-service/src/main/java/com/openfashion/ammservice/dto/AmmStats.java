package com.openfashion.ammservice.dto;

public record AmmStats(
        long poolCount,
        long totalSwaps,
        long totalVolume,
        long totalFeesCollected
) {}
