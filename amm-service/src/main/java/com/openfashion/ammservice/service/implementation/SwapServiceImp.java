package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.core.config.AmmProperties;
import com.openfashion.ammservice.core.exceptions.*;
import com.openfashion.ammservice.core.util.AmmMath;
import com.openfashion.ammservice.dto.*;
import com.openfashion.ammservice.dto.event.SwapExecutedEvent;
import com.openfashion.ammservice.model.LiquidityPool;
import com.openfashion.ammservice.model.ProtocolStat;
import com.openfashion.ammservice.model.StatKey;
import com.openfashion.ammservice.model.SwapRecord;
import com.openfashion.ammservice.repository.LiquidityPoolRepository;
import com.openfashion.ammservice.repository.ProtocolStatRepository;
import com.openfashion.ammservice.repository.SwapRecordRepository;
import com.openfashion.ammservice.service.AssetTransferService;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.OutboxService;
import com.openfashion.ammservice.service.SwapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SwapServiceImp implements SwapService {

    private final LiquidityPoolRepository poolRepository;
    private final SwapRecordRepository swapRepository;
    private final ProtocolStatRepository statRepository;
    private final AssetTransferService assetTransferService;
    private final OutboxService outboxService;
    private final BlockClock blockClock;
    private final AmmProperties properties;

    private static final String SWAP_EXECUTED_EVENT = "SWAP_EXECUTED";

    @Override
    @Transactional
    public SwapResult swap(String caller, long poolId, long amountIn, long minAmountOut, String assetIn) {
        LiquidityPool pool = findPool(poolId);
        if (!pool.isActive()) {
            throw new PoolInactiveException(poolId);
        }
        Direction direction = Direction.of(pool, assetIn, amountIn);

        if (direction.amountOut() <= 0) {
            throw new InsufficientLiquidityException("Swapping " + amountIn + " " + assetIn
                    + " in pool " + poolId + " yields nothing");
        }
        if (direction.amountOut() < minAmountOut) {
            throw new SlippageExceededException("amount out", direction.amountOut(), minAmountOut);
        }

        long newReserveIn = AmmMath.add(direction.reserveIn(), amountIn);
        long newReserveOut = direction.reserveOut() - direction.amountOut();

        // the record id is the swap count before this swap
        long swapId = statRepository.valueOf(StatKey.TOTAL_SWAPS);
        long totalSwaps = AmmMath.add(swapId, 1L);
        long totalVolume = AmmMath.add(statRepository.valueOf(StatKey.TOTAL_VOLUME), amountIn);
        long totalFees = AmmMath.add(statRepository.valueOf(StatKey.TOTAL_FEES_COLLECTED), direction.fee());
        long block = blockClock.currentBlock();

        transfer(assetIn, amountIn, caller, properties.getCustodian());

        if (direction.aToB()) {
            pool.setReserveA(newReserveIn);
            pool.setReserveB(newReserveOut);
        } else {
            pool.setReserveB(newReserveIn);
            pool.setReserveA(newReserveOut);
        }
        pool.setLastPriceA(AmmMath.price(pool.getReserveA(), pool.getReserveB()));
        pool.setLastPriceB(AmmMath.price(pool.getReserveB(), pool.getReserveA()));
        poolRepository.save(pool);

        transfer(direction.assetOut(), direction.amountOut(), properties.getCustodian(), caller);

        swapRepository.save(SwapRecord.builder()
                .id(swapId)
                .poolId(poolId)
                .trader(caller)
                .assetIn(assetIn)
                .assetOut(direction.assetOut())
                .amountIn(amountIn)
                .amountOut(direction.amountOut())
                .feePaid(direction.fee())
                .priceImpact(direction.priceImpact())
                .blockHeight(block)
                .build());

        writeStat(StatKey.TOTAL_SWAPS, totalSwaps);
        writeStat(StatKey.TOTAL_VOLUME, totalVolume);
        writeStat(StatKey.TOTAL_FEES_COLLECTED, totalFees);

        outboxService.record(SWAP_EXECUTED_EVENT, String.valueOf(swapId), new SwapExecutedEvent(
                swapId, poolId, caller, assetIn, direction.assetOut(), amountIn, direction.amountOut(),
                direction.fee(), direction.priceImpact(), block));
        log.info("Swap {} in pool {}: {} {} -> {} {} (fee {}, impact {} bp)", swapId, poolId,
                amountIn, assetIn, direction.amountOut(), direction.assetOut(), direction.fee(), direction.priceImpact());

        return new SwapResult(swapId, direction.amountOut(), direction.fee(), direction.priceImpact());
    }

    @Override
    @Transactional(readOnly = true)
    public SwapQuote getSwapQuote(long poolId, long amountIn, String assetIn) {
        Direction direction = Direction.of(findPool(poolId), assetIn, amountIn);
        return new SwapQuote(direction.amountOut(), direction.fee(), direction.priceImpact());
    }

    @Override
    @Transactional(readOnly = true)
    public SwapDetails getSwap(long swapId) {
        return swapRepository.findById(swapId)
                .map(SwapDetails::from)
                .orElseThrow(() -> new SwapNotFoundException(swapId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SwapDetails> getPoolSwaps(long poolId) {
        findPool(poolId);
        return swapRepository.findAllByPoolIdOrderById(poolId).stream()
                .map(SwapDetails::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public AmmStats getProtocolStats() {
        return new AmmStats(
                statRepository.valueOf(StatKey.POOL_COUNT),
                statRepository.valueOf(StatKey.TOTAL_SWAPS),
                statRepository.valueOf(StatKey.TOTAL_VOLUME),
                statRepository.valueOf(StatKey.TOTAL_FEES_COLLECTED)
        );
    }

    private LiquidityPool findPool(long poolId) {
        return poolRepository.findById(poolId)
                .orElseThrow(() -> new PoolNotFoundException(poolId));
    }

    private void transfer(String asset, long amount, String from, String to) {
        TransferResult result = assetTransferService.transfer(asset, amount, from, to);
        if (!result.success()) {
            log.error("Transfer of {} {} from {} to {} failed: {}", amount, asset, from, to, result.failureReason());
            throw new TransferFailedException(from, to, amount, result.failureReason());
        }
    }

    private void writeStat(StatKey key, long value) {
        ProtocolStat stat = statRepository.findById(key.name())
                .orElseGet(() -> new ProtocolStat(key));
        stat.setValue(value);
        statRepository.save(stat);
    }

    /**
     * Trade figures for one direction of a pool, computed against the reserves before the trade.
     */
    private record Direction(boolean aToB, String assetOut, long reserveIn, long reserveOut,
                             long amountOut, long fee, long priceImpact) {

        static Direction of(LiquidityPool pool, String assetIn, long amountIn) {
            if (amountIn <= 0) {
                throw new InvalidAmountException("Swap amount must be positive, got " + amountIn);
            }

            boolean aToB;
            if (pool.getAssetA().equals(assetIn)) {
                aToB = true;
            } else if (pool.getAssetB().equals(assetIn)) {
                aToB = false;
            } else {
                throw new InvalidAssetException("Asset " + assetIn + " is not traded in pool " + pool.getId());
            }

            long reserveIn = aToB ? pool.getReserveA() : pool.getReserveB();
            long reserveOut = aToB ? pool.getReserveB() : pool.getReserveA();
            long amountOut = AmmMath.amountOut(amountIn, reserveIn, reserveOut, pool.getFeeRate());

            return new Direction(
                    aToB,
                    aToB ? pool.getAssetB() : pool.getAssetA(),
                    reserveIn,
                    reserveOut,
                    amountOut,
                    AmmMath.fee(amountIn, pool.getFeeRate()),
                    AmmMath.priceImpact(amountOut, reserveOut)
            );
        }
    }
}
