package com.openfashion.ammservice.dto;

import com.openfashion.ammservice.model.FarmingPosition;

public record FarmingPositionDetails(
        long poolId,
        String accountId,
        long stakedAmount,
        long rewardDebt,
        long pendingRewards
) {

    public static FarmingPositionDetails from(FarmingPosition position) {
        return new FarmingPositionDetails(
                position.getPoolId(),
                position.getAccountId(),
                position.getStakedAmount(),
                position.getRewardDebt(),
                position.getPendingRewards()
        );
    }

    public static FarmingPositionDetails empty(long poolId, String accountId) {
        return new FarmingPositionDetails(poolId, accountId, 0L, 0L, 0L);
    }
}
