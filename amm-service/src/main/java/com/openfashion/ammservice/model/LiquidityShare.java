package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "liquidity_shares", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"pool_id", "provider"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidityShare {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pool_id", nullable = false)
    private long poolId;

    @Column(nullable = false)
    private String provider;

    @Column(nullable = false)
    @PositiveOrZero
    private long shares;

    @Column(nullable = false)
    @Version
    private long version;

    @UpdateTimestamp
    private Instant updatedAt;
}
