package com.openfashion.ammservice.controller;

import com.openfashion.ammservice.dto.CreateFarmingPoolRequest;
import com.openfashion.ammservice.dto.FarmingPoolDetails;
import com.openfashion.ammservice.dto.FarmingPositionDetails;
import com.openfashion.ammservice.service.FarmingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/farming")
@RequiredArgsConstructor
public class FarmingController {

    private final FarmingService farmingService;

    @PostMapping("/pools")
    public ResponseEntity<FarmingPoolDetails> createFarmingPool(@RequestHeader("X-Account-ID") String caller,
                                                                @RequestBody CreateFarmingPoolRequest request) {
        FarmingPoolDetails farm = farmingService.createFarmingPool(
                caller, request.poolId(), request.rewardPerBlock(), request.startBlock(), request.endBlock());
        return new ResponseEntity<>(farm, HttpStatus.CREATED);
    }

    @GetMapping("/pools/{poolId}")
    public FarmingPoolDetails getFarmingPool(@PathVariable long poolId) {
        return farmingService.getFarmingPool(poolId);
    }

    @GetMapping("/pools/{poolId}/positions/{accountId}")
    public FarmingPositionDetails getFarmingPosition(@PathVariable long poolId, @PathVariable String accountId) {
        return farmingService.getFarmingPosition(poolId, accountId);
    }
}
