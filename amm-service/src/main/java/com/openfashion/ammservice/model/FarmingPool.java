package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "farming_pools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FarmingPool {

    // Same id as the liquidity pool it rewards.
    @Id
    private Long poolId;

    @Column(nullable = false)
    private long rewardPerBlock;

    @Column(nullable = false)
    private long startBlock;

    @Column(nullable = false)
    private long endBlock;

    @Column(nullable = false)
    private long lastRewardBlock;

    @Column(nullable = false)
    private long accRewardPerShare;

    @Column(nullable = false)
    private long totalStaked;

    @Version
    private Long version;
}
