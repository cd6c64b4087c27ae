package com.openfashion.ammservice.service.implementation;

import com.openfashion.ammservice.core.config.AmmProperties;
import com.openfashion.ammservice.core.exceptions.*;
import com.openfashion.ammservice.core.util.AmmMath;
import com.openfashion.ammservice.dto.LiquidityChange;
import com.openfashion.ammservice.dto.PoolCreatedResponse;
import com.openfashion.ammservice.dto.PoolDetails;
import com.openfashion.ammservice.dto.TransferResult;
import com.openfashion.ammservice.dto.event.FeeRateUpdatedEvent;
import com.openfashion.ammservice.dto.event.LiquidityChangedEvent;
import com.openfashion.ammservice.dto.event.PoolCreatedEvent;
import com.openfashion.ammservice.model.*;
import com.openfashion.ammservice.repository.AccountPoolsRepository;
import com.openfashion.ammservice.repository.LiquidityPoolRepository;
import com.openfashion.ammservice.repository.LiquidityShareRepository;
import com.openfashion.ammservice.repository.ProtocolStatRepository;
import com.openfashion.ammservice.service.AssetTransferService;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.OutboxService;
import com.openfashion.ammservice.service.PoolService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class PoolServiceImp implements PoolService {

    private final LiquidityPoolRepository poolRepository;
    private final LiquidityShareRepository shareRepository;
    private final AccountPoolsRepository accountPoolsRepository;
    private final ProtocolStatRepository statRepository;
    private final AssetTransferService assetTransferService;
    private final OutboxService outboxService;
    private final BlockClock blockClock;
    private final AmmProperties properties;

    private static final String POOL_CREATED_EVENT = "POOL_CREATED";
    private static final String LIQUIDITY_ADDED_EVENT = "LIQUIDITY_ADDED";
    private static final String LIQUIDITY_REMOVED_EVENT = "LIQUIDITY_REMOVED";
    private static final String FEE_RATE_UPDATED_EVENT = "FEE_RATE_UPDATED";

    @Override
    @Transactional
    public PoolCreatedResponse createPool(String caller, String assetA, String assetB, long amountA, long amountB) {
        requirePositive(amountA, "Initial amount of asset A");
        requirePositive(amountB, "Initial amount of asset B");
        if (assetA == null || assetA.isBlank() || assetB == null || assetB.isBlank()) {
            throw new InvalidAssetException("Both pool assets must be named");
        }
        if (assetA.equals(assetB)) {
            throw new InvalidAssetException("A pool needs two distinct assets, got " + assetA + " twice");
        }

        long liquidity = AmmMath.initialLiquidity(amountA, amountB);
        if (liquidity < properties.getMinLiquidity()) {
            throw new InsufficientLiquidityException("Initial liquidity " + liquidity
                    + " is below the minimum " + properties.getMinLiquidity());
        }

        AccountPools memberships = accountPoolsRepository.findById(caller)
                .orElseGet(() -> new AccountPools(caller));
        if (memberships.getPoolIds().size() >= properties.getMaxPoolsPerAccount()) {
            throw new InvalidAmountException("Account " + caller + " already holds the maximum of "
                    + properties.getMaxPoolsPerAccount() + " pools");
        }

        long poolId = AmmMath.add(statRepository.valueOf(StatKey.POOL_COUNT), 1L);
        long block = blockClock.currentBlock();

        transfer(assetA, amountA, caller, properties.getCustodian());
        transfer(assetB, amountB, caller, properties.getCustodian());

        LiquidityPool pool = LiquidityPool.builder()
                .id(poolId)
                .assetA(assetA)
                .assetB(assetB)
                .reserveA(amountA)
                .reserveB(amountB)
                .totalSupply(liquidity)
                .feeRate(properties.getDefaultFeeRate())
                .lastPriceA(AmmMath.price(amountA, amountB))
                .lastPriceB(AmmMath.price(amountB, amountA))
                .createdAtBlock(block)
                .active(true)
                .build();
        poolRepository.save(pool);

        writeShares(poolId, caller, liquidity);
        memberships.getPoolIds().add(poolId);
        accountPoolsRepository.save(memberships);
        writeStat(StatKey.POOL_COUNT, poolId);

        outboxService.record(POOL_CREATED_EVENT, String.valueOf(poolId), new PoolCreatedEvent(
                poolId, caller, assetA, assetB, amountA, amountB, liquidity, block));
        log.info("Pool {} created by {}: {} {} / {} {}, {} shares minted",
                poolId, caller, amountA, assetA, amountB, assetB, liquidity);

        return new PoolCreatedResponse(poolId, liquidity);
    }

    @Override
    @Transactional
    public LiquidityChange addLiquidity(String caller, long poolId, long amountA, long amountB, long minLiquidity) {
        LiquidityPool pool = findActivePool(poolId);
        requirePositive(amountA, "Amount of asset A");
        requirePositive(amountB, "Amount of asset B");

        // the smaller proportional contribution decides; the surplus of the other asset is donated
        long minted = Math.min(
                AmmMath.mulDiv(amountA, pool.getTotalSupply(), pool.getReserveA()),
                AmmMath.mulDiv(amountB, pool.getTotalSupply(), pool.getReserveB()));
        if (minted <= 0) {
            throw new InvalidAmountException("Deposit too small to mint any shares of pool " + poolId);
        }
        if (minted < minLiquidity) {
            throw new SlippageExceededException("minted shares", minted, minLiquidity);
        }

        long reserveA = AmmMath.add(pool.getReserveA(), amountA);
        long reserveB = AmmMath.add(pool.getReserveB(), amountB);
        long totalSupply = AmmMath.add(pool.getTotalSupply(), minted);
        long shares = AmmMath.add(shareRepository.sharesOf(poolId, caller), minted);
        long block = blockClock.currentBlock();

        transfer(pool.getAssetA(), amountA, caller, properties.getCustodian());
        transfer(pool.getAssetB(), amountB, caller, properties.getCustodian());

        pool.setReserveA(reserveA);
        pool.setReserveB(reserveB);
        pool.setTotalSupply(totalSupply);
        poolRepository.save(pool);
        writeShares(poolId, caller, shares);

        outboxService.record(LIQUIDITY_ADDED_EVENT, String.valueOf(poolId), new LiquidityChangedEvent(
                poolId, caller, minted, amountA, amountB, totalSupply, block));
        log.info("Provider {} added {} / {} to pool {} for {} shares", caller, amountA, amountB, poolId, minted);

        return new LiquidityChange(poolId, minted, amountA, amountB);
    }

    /**
     * Burns {@code liquidity} shares for the proportional slice of both reserves.
     * <p>
     * Besides the balance and slippage checks, two rules keep the reserves strictly positive:
     * the whole outstanding supply can never be burned, so a sole provider cannot fully exit and
     * always leaves at least one share behind, and a burn whose slice rounds down to zero of either
     * asset is rejected as an invalid amount.
     */
    @Override
    @Transactional
    public LiquidityChange removeLiquidity(String caller, long poolId, long liquidity, long minAmountA, long minAmountB) {
        LiquidityPool pool = findActivePool(poolId);
        requirePositive(liquidity, "Liquidity to remove");

        long held = shareRepository.sharesOf(poolId, caller);
        if (held < liquidity) {
            throw new InsufficientBalanceException(caller, poolId, liquidity, held);
        }
        if (liquidity >= pool.getTotalSupply()) {
            throw new InsufficientLiquidityException("Removing " + liquidity + " shares would drain pool " + poolId);
        }

        long amountA = AmmMath.mulDiv(liquidity, pool.getReserveA(), pool.getTotalSupply());
        long amountB = AmmMath.mulDiv(liquidity, pool.getReserveB(), pool.getTotalSupply());
        if (amountA <= 0 || amountB <= 0) {
            throw new InvalidAmountException("Burning " + liquidity + " shares of pool " + poolId + " returns nothing");
        }
        if (amountA < minAmountA) {
            throw new SlippageExceededException("amount of " + pool.getAssetA(), amountA, minAmountA);
        }
        if (amountB < minAmountB) {
            throw new SlippageExceededException("amount of " + pool.getAssetB(), amountB, minAmountB);
        }

        long block = blockClock.currentBlock();
        long totalSupply = pool.getTotalSupply() - liquidity;

        pool.setReserveA(pool.getReserveA() - amountA);
        pool.setReserveB(pool.getReserveB() - amountB);
        pool.setTotalSupply(totalSupply);
        poolRepository.save(pool);
        writeShares(poolId, caller, held - liquidity);

        transfer(pool.getAssetA(), amountA, properties.getCustodian(), caller);
        transfer(pool.getAssetB(), amountB, properties.getCustodian(), caller);

        outboxService.record(LIQUIDITY_REMOVED_EVENT, String.valueOf(poolId), new LiquidityChangedEvent(
                poolId, caller, liquidity, amountA, amountB, totalSupply, block));
        log.info("Provider {} burned {} shares of pool {} for {} / {}", caller, liquidity, poolId, amountA, amountB);

        return new LiquidityChange(poolId, liquidity, amountA, amountB);
    }

    @Override
    @Transactional
    public void updateFeeRate(String caller, long poolId, long feeRate) {
        if (!properties.isOwner(caller)) {
            throw new UnauthorizedException(caller, "update the fee rate of pool " + poolId);
        }
        LiquidityPool pool = findPool(poolId);
        if (feeRate < 0 || feeRate > properties.getMaxFeeRate()) {
            throw new InvalidAmountException("Fee rate must be between 0 and " + properties.getMaxFeeRate() + ", got " + feeRate);
        }

        long previous = pool.getFeeRate();
        pool.setFeeRate(feeRate);
        poolRepository.save(pool);

        outboxService.record(FEE_RATE_UPDATED_EVENT, String.valueOf(poolId), new FeeRateUpdatedEvent(
                poolId, previous, feeRate, blockClock.currentBlock()));
        log.info("Fee rate of pool {} changed from {} to {}", poolId, previous, feeRate);
    }

    @Override
    @Transactional(readOnly = true)
    public PoolDetails getPool(long poolId) {
        return PoolDetails.from(findPool(poolId));
    }

    @Override
    @Transactional(readOnly = true)
    public long getLiquidityBalance(long poolId, String provider) {
        return shareRepository.sharesOf(poolId, provider);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> getAccountPools(String accountId) {
        return accountPoolsRepository.findById(accountId)
                .map(memberships -> List.copyOf(memberships.getPoolIds()))
                .orElse(List.of());
    }

    private LiquidityPool findPool(long poolId) {
        return poolRepository.findById(poolId)
                .orElseThrow(() -> new PoolNotFoundException(poolId));
    }

    private LiquidityPool findActivePool(long poolId) {
        LiquidityPool pool = findPool(poolId);
        if (!pool.isActive()) {
            throw new PoolInactiveException(poolId);
        }
        return pool;
    }

    private void requirePositive(long amount, String what) {
        if (amount <= 0) {
            throw new InvalidAmountException(what + " must be positive, got " + amount);
        }
    }

    private void transfer(String asset, long amount, String from, String to) {
        TransferResult result = assetTransferService.transfer(asset, amount, from, to);
        if (!result.success()) {
            log.error("Transfer of {} {} from {} to {} failed: {}", amount, asset, from, to, result.failureReason());
            throw new TransferFailedException(from, to, amount, result.failureReason());
        }
    }

    private void writeShares(long poolId, String provider, long shares) {
        LiquidityShare share = shareRepository.findByPoolIdAndProvider(poolId, provider)
                .orElseGet(() -> LiquidityShare.builder().poolId(poolId).provider(provider).build());
        share.setShares(shares);
        shareRepository.save(share);
    }

    private void writeStat(StatKey key, long value) {
        ProtocolStat stat = statRepository.findById(key.name())
                .orElseGet(() -> new ProtocolStat(key));
        stat.setValue(value);
        statRepository.save(stat);
    }
}
