package com.openfashion.ammservice.dto.event;

public record FarmingPoolCreatedEvent(
        long poolId,
        long rewardPerBlock,
        long startBlock,
        long endBlock,
        long block
) {}
