package com.openfashion.ammservice.dto;

import com.openfashion.ammservice.model.FarmingPool;

public record FarmingPoolDetails(
        long poolId,
        long rewardPerBlock,
        long startBlock,
        long endBlock,
        long lastRewardBlock,
        long accRewardPerShare,
        long totalStaked
) {

    public static FarmingPoolDetails from(FarmingPool farm) {
        return new FarmingPoolDetails(
                farm.getPoolId(),
                farm.getRewardPerBlock(),
                farm.getStartBlock(),
                farm.getEndBlock(),
                farm.getLastRewardBlock(),
                farm.getAccRewardPerShare(),
                farm.getTotalStaked()
        );
    }
}
