package com.openfashion.ammservice;

import com.openfashion.ammservice.core.config.AmmProperties;
import com.openfashion.ammservice.core.exceptions.*;
import com.openfashion.ammservice.dto.LiquidityChange;
import com.openfashion.ammservice.dto.PoolCreatedResponse;
import com.openfashion.ammservice.dto.TransferResult;
import com.openfashion.ammservice.model.AccountPools;
import com.openfashion.ammservice.model.LiquidityPool;
import com.openfashion.ammservice.model.LiquidityShare;
import com.openfashion.ammservice.repository.AccountPoolsRepository;
import com.openfashion.ammservice.repository.LiquidityPoolRepository;
import com.openfashion.ammservice.repository.LiquidityShareRepository;
import com.openfashion.ammservice.repository.ProtocolStatRepository;
import com.openfashion.ammservice.service.AssetTransferService;
import com.openfashion.ammservice.service.BlockClock;
import com.openfashion.ammservice.service.OutboxService;
import com.openfashion.ammservice.service.implementation.PoolServiceImp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PoolServiceUnitTest {

    @Mock
    private LiquidityPoolRepository poolRepository;
    @Mock
    private LiquidityShareRepository shareRepository;
    @Mock
    private AccountPoolsRepository accountPoolsRepository;
    @Mock
    private ProtocolStatRepository statRepository;
    @Mock
    private AssetTransferService assetTransferService;
    @Mock
    private OutboxService outboxService;
    @Mock
    private BlockClock blockClock;

    private PoolServiceImp poolService;

    private static final String CUSTODIAN = "amm-pool";
    private static final String OWNER = "amm-admin";

    @BeforeEach
    void setUp() {
        AmmProperties properties = new AmmProperties();
        properties.setOwner(OWNER);
        properties.setCustodian(CUSTODIAN);

        poolService = new PoolServiceImp(poolRepository, shareRepository, accountPoolsRepository, statRepository,
                assetTransferService, outboxService, blockClock, properties);
    }

    @Test
    @DisplayName("Creating a 1e6/1e6 pool mints 1e6 shares at unit prices")
    void testCreatePool_Success() {
        when(accountPoolsRepository.findById("alice")).thenReturn(Optional.empty());
        when(assetTransferService.transfer(any(), anyLong(), eq("alice"), eq(CUSTODIAN)))
                .thenReturn(TransferResult.success(UUID.randomUUID()));

        PoolCreatedResponse response = poolService.createPool("alice", "STX", "USDA", 1_000_000L, 1_000_000L);

        assertThat(response.poolId()).isEqualTo(1L);
        assertThat(response.liquidity()).isEqualTo(1_000_000L);

        ArgumentCaptor<LiquidityPool> captor = ArgumentCaptor.forClass(LiquidityPool.class);
        verify(poolRepository).save(captor.capture());
        LiquidityPool pool = captor.getValue();
        assertThat(pool.getReserveA()).isEqualTo(1_000_000L);
        assertThat(pool.getReserveB()).isEqualTo(1_000_000L);
        assertThat(pool.getLastPriceA()).isEqualTo(1_000_000L);
        assertThat(pool.getLastPriceB()).isEqualTo(1_000_000L);
        assertThat(pool.getFeeRate()).isEqualTo(30L);
        assertThat(pool.isActive()).isTrue();

        verify(shareRepository).save(argThat(s -> s.getProvider().equals("alice") && s.getShares() == 1_000_000L));
        verify(accountPoolsRepository).save(argThat(a -> a.getPoolIds().equals(List.of(1L))));
        verify(outboxService).record(eq("POOL_CREATED"), eq("1"), any());
    }

    @Test
    @DisplayName("A pool of one asset against itself is rejected")
    void testCreatePool_SameAsset() {
        assertThatThrownBy(() -> poolService.createPool("alice", "STX", "STX", 5000L, 5000L))
                .isInstanceOf(InvalidAssetException.class);

        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("Seed liquidity below the minimum is rejected")
    void testCreatePool_BelowMinimumLiquidity() {
        // isqrt(999 * 1000) = 999
        assertThatThrownBy(() -> poolService.createPool("alice", "STX", "USDA", 999L, 1000L))
                .isInstanceOf(InsufficientLiquidityException.class);

        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("A full pool membership list rejects the 21st pool before any transfer")
    void testCreatePool_MembershipListFull() {
        AccountPools memberships = new AccountPools("alice");
        LongStream.rangeClosed(1, 20).forEach(memberships.getPoolIds()::add);
        when(accountPoolsRepository.findById("alice")).thenReturn(Optional.of(memberships));

        assertThatThrownBy(() -> poolService.createPool("alice", "STX", "USDA", 1_000_000L, 1_000_000L))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("20");

        verifyNoInteractions(assetTransferService);
        verify(poolRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unbalanced deposits mint by the smaller proportional contribution")
    void testAddLiquidity_MintsMinimum() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000_000L, 2_000_000L, 1_000_000L)));
        when(assetTransferService.transfer(any(), anyLong(), eq("bob"), eq(CUSTODIAN)))
                .thenReturn(TransferResult.success(UUID.randomUUID()));

        LiquidityChange change = poolService.addLiquidity("bob", 1L, 1000L, 1000L, 400L);

        // min(1000 * 1e6 / 1e6, 1000 * 1e6 / 2e6)
        assertThat(change.shares()).isEqualTo(500L);
        verify(shareRepository).save(argThat(s -> s.getProvider().equals("bob") && s.getShares() == 500L));
    }

    @Test
    @DisplayName("Minted shares below the caller's minimum trip the slippage guard")
    void testAddLiquidity_Slippage() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000_000L, 2_000_000L, 1_000_000L)));

        assertThatThrownBy(() -> poolService.addLiquidity("bob", 1L, 1000L, 1000L, 501L))
                .isInstanceOf(SlippageExceededException.class);

        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("Inactive pools refuse new liquidity")
    void testAddLiquidity_InactivePool() {
        LiquidityPool inactive = pool(1_000_000L, 1_000_000L, 1_000_000L);
        inactive.setActive(false);
        when(poolRepository.findById(1L)).thenReturn(Optional.of(inactive));

        assertThatThrownBy(() -> poolService.addLiquidity("bob", 1L, 1000L, 1000L, 0L))
                .isInstanceOf(PoolInactiveException.class);
    }

    @Test
    @DisplayName("Burning more shares than held is rejected")
    void testRemoveLiquidity_InsufficientBalance() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000_000L, 1_000_000L, 1_000_000L)));
        when(shareRepository.sharesOf(1L, "bob")).thenReturn(10L);

        assertThatThrownBy(() -> poolService.removeLiquidity("bob", 1L, 11L, 0L, 0L))
                .isInstanceOf(InsufficientBalanceException.class);

        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("Burning the entire supply is rejected")
    void testRemoveLiquidity_WouldDrainPool() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000_000L, 1_000_000L, 1_000_000L)));
        when(shareRepository.sharesOf(1L, "alice")).thenReturn(1_000_000L);

        assertThatThrownBy(() -> poolService.removeLiquidity("alice", 1L, 1_000_000L, 0L, 0L))
                .isInstanceOf(InsufficientLiquidityException.class)
                .hasMessageContaining("drain");

        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("A burn too small to return both assets is rejected")
    void testRemoveLiquidity_NothingReturned() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000L, 1_000_000L, 1_000_000L)));
        when(shareRepository.sharesOf(1L, "alice")).thenReturn(1_000_000L);

        assertThatThrownBy(() -> poolService.removeLiquidity("alice", 1L, 1L, 0L, 0L))
                .isInstanceOf(InvalidAmountException.class)
                .hasMessageContaining("returns nothing");

        verify(poolRepository, never()).save(any());
        verifyNoInteractions(assetTransferService);
    }

    @Test
    @DisplayName("Removal writes the reduced reserves before paying out")
    void testRemoveLiquidity_Success() {
        LiquidityPool pool = pool(1_000_000L, 2_000_000L, 1_000_000L);
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool));
        when(shareRepository.sharesOf(1L, "alice")).thenReturn(1_000_000L);
        when(shareRepository.findByPoolIdAndProvider(1L, "alice"))
                .thenReturn(Optional.of(LiquidityShare.builder().poolId(1L).provider("alice").shares(1_000_000L).build()));
        when(assetTransferService.transfer(any(), anyLong(), eq(CUSTODIAN), eq("alice")))
                .thenReturn(TransferResult.success(UUID.randomUUID()));

        LiquidityChange change = poolService.removeLiquidity("alice", 1L, 100_000L, 100_000L, 200_000L);

        assertThat(change.amountA()).isEqualTo(100_000L);
        assertThat(change.amountB()).isEqualTo(200_000L);
        assertThat(pool.getReserveA()).isEqualTo(900_000L);
        assertThat(pool.getReserveB()).isEqualTo(1_800_000L);
        assertThat(pool.getTotalSupply()).isEqualTo(900_000L);

        var order = inOrder(poolRepository, assetTransferService);
        order.verify(poolRepository).save(pool);
        order.verify(assetTransferService).transfer("STX", 100_000L, CUSTODIAN, "alice");
        order.verify(assetTransferService).transfer("USDA", 200_000L, CUSTODIAN, "alice");
    }

    @Test
    @DisplayName("Only the owner may change a pool's fee rate")
    void testUpdateFeeRate_Unauthorized() {
        assertThatThrownBy(() -> poolService.updateFeeRate("alice", 1L, 50L))
                .isInstanceOf(UnauthorizedException.class);

        verifyNoInteractions(poolRepository);
    }

    @Test
    @DisplayName("Fee rates above the maximum are rejected")
    void testUpdateFeeRate_AboveMaximum() {
        when(poolRepository.findById(1L)).thenReturn(Optional.of(pool(1_000_000L, 1_000_000L, 1_000_000L)));

        assertThatThrownBy(() -> poolService.updateFeeRate(OWNER, 1L, 1001L))
                .isInstanceOf(InvalidAmountException.class);

        verify(poolRepository, never()).save(any());
    }

    private LiquidityPool pool(long reserveA, long reserveB, long totalSupply) {
        return LiquidityPool.builder()
                .id(1L)
                .assetA("STX")
                .assetB("USDA")
                .reserveA(reserveA)
                .reserveB(reserveB)
                .totalSupply(totalSupply)
                .feeRate(30L)
                .active(true)
                .build();
    }
}
