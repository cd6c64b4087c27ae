package com.openfashion.ammservice.service;

import com.openfashion.ammservice.dto.LiquidityChange;
import com.openfashion.ammservice.dto.PoolCreatedResponse;
import com.openfashion.ammservice.dto.PoolDetails;

import java.util.List;

public interface PoolService {

    PoolCreatedResponse createPool(String caller, String assetA, String assetB, long amountA, long amountB);

    LiquidityChange addLiquidity(String caller, long poolId, long amountA, long amountB, long minLiquidity);

    LiquidityChange removeLiquidity(String caller, long poolId, long liquidity, long minAmountA, long minAmountB);

    /**
     * Owner only.
     */
    void updateFeeRate(String caller, long poolId, long feeRate);

    PoolDetails getPool(long poolId);

    long getLiquidityBalance(long poolId, String provider);

    /**
     * Pools the account created, in creation order.
     */
    List<Long> getAccountPools(String accountId);
}
