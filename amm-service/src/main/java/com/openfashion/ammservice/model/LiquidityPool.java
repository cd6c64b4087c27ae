package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "liquidity_pools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidityPool {

    // Assigned from the POOL_COUNT statistic.
    @Id
    private Long id;

    @Column(nullable = false)
    private String assetA;

    @Column(nullable = false)
    private String assetB;

    @Column(nullable = false)
    private long reserveA;

    @Column(nullable = false)
    private long reserveB;

    @Column(nullable = false)
    private long totalSupply;

    @Column(nullable = false)
    private long feeRate;

    // 6-decimal fixed point: reserveA * 1_000_000 / reserveB
    @Column(nullable = false)
    private long lastPriceA;

    @Column(nullable = false)
    private long lastPriceB;

    @Column(nullable = false)
    private long createdAtBlock;

    @Column(nullable = false)
    private boolean active;

    @Version
    private Long version;
}
