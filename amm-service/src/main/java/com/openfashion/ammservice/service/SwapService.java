package com.openfashion.ammservice.service;

import com.openfashion.ammservice.dto.AmmStats;
import com.openfashion.ammservice.dto.SwapDetails;
import com.openfashion.ammservice.dto.SwapQuote;
import com.openfashion.ammservice.dto.SwapResult;

import java.util.List;

public interface SwapService {

    SwapResult swap(String caller, long poolId, long amountIn, long minAmountOut, String assetIn);

    /**
     * Same figures {@link #swap} would produce against the current reserves, without executing.
     */
    SwapQuote getSwapQuote(long poolId, long amountIn, String assetIn);

    SwapDetails getSwap(long swapId);

    List<SwapDetails> getPoolSwaps(long poolId);

    AmmStats getProtocolStats();
}
