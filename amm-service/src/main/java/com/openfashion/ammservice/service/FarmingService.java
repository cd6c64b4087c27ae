package com.openfashion.ammservice.service;

import com.openfashion.ammservice.dto.FarmingPoolDetails;
import com.openfashion.ammservice.dto.FarmingPositionDetails;

public interface FarmingService {

    FarmingPoolDetails createFarmingPool(String caller, long poolId, long rewardPerBlock, long startBlock, long endBlock);

    FarmingPoolDetails getFarmingPool(long poolId);

    FarmingPositionDetails getFarmingPosition(long poolId, String accountId);
}
