package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "farming_positions", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"pool_id", "account_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FarmingPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pool_id", nullable = false)
    private long poolId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false)
    private long stakedAmount;

    @Column(nullable = false)
    private long rewardDebt;

    @Column(nullable = false)
    private long pendingRewards;

    @Column(nullable = false)
    @Version
    private long version;
}
