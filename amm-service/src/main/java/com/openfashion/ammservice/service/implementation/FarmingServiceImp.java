package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.core.config.AmmProperties;
import com.openfashion.ammservice.core.exceptions.*;
import com.openfashion.ammservice.dto.FarmingPoolDetails;
import com.openfashion.ammservice.dto.FarmingPositionDetails;
import com.openfashion.ammservice.dto.event.FarmingPoolCreatedEvent;
import com.openfashion.ammservice.model.FarmingPool;
import com.openfashion.ammservice.repository.FarmingPoolRepository;
import com.openfashion.ammservice.repository.FarmingPositionRepository;
import com.openfashion.ammservice.repository.LiquidityPoolRepository;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.FarmingService;
import com.openfashion.ammservice.service.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registers reward schedules for liquidity pools. Reward accrual and staking are not implemented;
 * the stored fields stay at their initial values.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FarmingServiceImp implements FarmingService {

    private final LiquidityPoolRepository poolRepository;
    private final FarmingPoolRepository farmingPoolRepository;
    private final FarmingPositionRepository farmingPositionRepository;
    private final OutboxService outboxService;
    private final BlockClock blockClock;
    private final AmmProperties properties;

    private static final String FARMING_POOL_CREATED_EVENT = "FARMING_POOL_CREATED";

    @Override
    @Transactional
    public FarmingPoolDetails createFarmingPool(String caller, long poolId, long rewardPerBlock, long startBlock, long endBlock) {
        if (!properties.isOwner(caller)) {
            throw new UnauthorizedException(caller, "create a farming pool for pool " + poolId);
        }
        if (!poolRepository.existsById(poolId)) {
            throw new PoolNotFoundException(poolId);
        }
        if (farmingPoolRepository.existsById(poolId)) {
            throw new FarmingPoolAlreadyExistsException(poolId);
        }
        if (rewardPerBlock <= 0) {
            throw new InvalidAmountException("Reward per block must be positive, got " + rewardPerBlock);
        }
        if (endBlock <= startBlock) {
            throw new InvalidAmountException("End block " + endBlock + " must be after start block " + startBlock);
        }

        long block = blockClock.currentBlock();
        FarmingPool farm = FarmingPool.builder()
                .poolId(poolId)
                .rewardPerBlock(rewardPerBlock)
                .startBlock(startBlock)
                .endBlock(endBlock)
                .lastRewardBlock(Math.max(startBlock, block))
                .accRewardPerShare(0L)
                .totalStaked(0L)
                .build();
        farmingPoolRepository.save(farm);

        outboxService.record(FARMING_POOL_CREATED_EVENT, String.valueOf(poolId), new FarmingPoolCreatedEvent(
                poolId, rewardPerBlock, startBlock, endBlock, block));
        log.info("Farming pool for pool {} created: {} per block, blocks {}..{}", poolId, rewardPerBlock, startBlock, endBlock);

        return FarmingPoolDetails.from(farm);
    }

    @Override
    @Transactional(readOnly = true)
    public FarmingPoolDetails getFarmingPool(long poolId) {
        return farmingPoolRepository.findById(poolId)
                .map(FarmingPoolDetails::from)
                .orElseThrow(() -> new FarmingPoolNotFoundException(poolId));
    }

    @Override
    @Transactional(readOnly = true)
    public FarmingPositionDetails getFarmingPosition(long poolId, String accountId) {
        return farmingPositionRepository.findByPoolIdAndAccountId(poolId, accountId)
                .map(FarmingPositionDetails::from)
                .orElseGet(() -> FarmingPositionDetails.empty(poolId, accountId));
    }
}
