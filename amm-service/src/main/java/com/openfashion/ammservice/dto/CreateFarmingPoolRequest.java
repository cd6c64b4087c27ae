package com.openfashion.ammservice.dto;

public record CreateFarmingPoolRequest(
        long poolId,
        long rewardPerBlock,
        long startBlock,
        long endBlock
) {}
