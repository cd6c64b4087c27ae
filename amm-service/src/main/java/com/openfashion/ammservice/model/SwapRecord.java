package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit trail entry for one executed swap. Written once, never updated.
 */
@Entity
@Table(name = "swap_records", indexes = {
        @Index(name = "idx_swap_pool", columnList = "pool_id"),
        @Index(name = "idx_swap_trader", columnList = "trader")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapRecord {

    @Id
    private Long id;

    @Column(name = "pool_id", nullable = false)
    private long poolId;

    @Column(nullable = false)
    private String trader;

    @Column(nullable = false)
    private String assetIn;

    @Column(nullable = false)
    private String assetOut;

    @Column(nullable = false)
    private long amountIn;

    @Column(nullable = false)
    private long amountOut;

    @Column(nullable = false)
    private long feePaid;

    // basis points of the output reserve before the swap
    @Column(nullable = false)
    private long priceImpact;

    @Column(nullable = false)
    private long blockHeight;

    @Version
    private Long version;
}
