package com.openfashion.ammservice.controller;

import com.openfashion.ammservice.dto.*;
import com.openfashion.ammservice.service.SwapService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/swaps")
@RequiredArgsConstructor
public class SwapController {

    private final SwapService swapService;

    @PostMapping
    public SwapResult swap(@RequestHeader("X-Account-ID") String caller,
                           @RequestBody @Valid SwapRequest request) {
        return swapService.swap(caller, request.poolId(), request.amountIn(), request.minAmountOut(), request.assetIn());
    }

    @GetMapping("/quote")
    public SwapQuote quote(@RequestParam long poolId,
                           @RequestParam long amountIn,
                           @RequestParam String assetIn) {
        return swapService.getSwapQuote(poolId, amountIn, assetIn);
    }

    @GetMapping("/{swapId}")
    public SwapDetails getSwap(@PathVariable long swapId) {
        return swapService.getSwap(swapId);
    }

    @GetMapping("/stats")
    public AmmStats getStats() {
        return swapService.getProtocolStats();
    }
}
