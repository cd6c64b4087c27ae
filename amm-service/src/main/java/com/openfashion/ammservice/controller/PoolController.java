package com.openfashion.ammservice.controller;

import com.openfashion.ammservice.dto.*;
import com.openfashion.ammservice.service.PoolService;
import com.openfashion.ammservice.service.SwapService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/pools")
@RequiredArgsConstructor
public class PoolController {

    private static final String ACCOUNT_HEADER = "X-Account-ID";

    private final PoolService poolService;
    private final SwapService swapService;

    @PostMapping
    public ResponseEntity<PoolCreatedResponse> createPool(@RequestHeader(ACCOUNT_HEADER) String caller,
                                                          @RequestBody @Valid CreatePoolRequest request) {
        PoolCreatedResponse response = poolService.createPool(
                caller, request.assetA(), request.assetB(), request.amountA(), request.amountB());
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @GetMapping("/{poolId}")
    public PoolDetails getPool(@PathVariable long poolId) {
        return poolService.getPool(poolId);
    }

    @PostMapping("/{poolId}/liquidity")
    public LiquidityChange addLiquidity(@RequestHeader(ACCOUNT_HEADER) String caller,
                                        @PathVariable long poolId,
                                        @RequestBody AddLiquidityRequest request) {
        return poolService.addLiquidity(caller, poolId, request.amountA(), request.amountB(), request.minLiquidity());
    }

    @PostMapping("/{poolId}/liquidity/removal")
    public LiquidityChange removeLiquidity(@RequestHeader(ACCOUNT_HEADER) String caller,
                                           @PathVariable long poolId,
                                           @RequestBody RemoveLiquidityRequest request) {
        return poolService.removeLiquidity(caller, poolId, request.liquidity(), request.minAmountA(), request.minAmountB());
    }

    @PutMapping("/{poolId}/fee-rate")
    public ResponseEntity<Void> updateFeeRate(@RequestHeader(ACCOUNT_HEADER) String caller,
                                              @PathVariable long poolId,
                                              @RequestBody FeeRateRequest request) {
        poolService.updateFeeRate(caller, poolId, request.feeRate());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{poolId}/shares/{provider}")
    public long getLiquidityBalance(@PathVariable long poolId, @PathVariable String provider) {
        return poolService.getLiquidityBalance(poolId, provider);
    }

    @GetMapping("/{poolId}/swaps")
    public List<SwapDetails> getPoolSwaps(@PathVariable long poolId) {
        return swapService.getPoolSwaps(poolId);
    }

    @GetMapping("/accounts/{accountId}")
    public List<Long> getAccountPools(@PathVariable String accountId) {
        return poolService.getAccountPools(accountId);
    }
}
