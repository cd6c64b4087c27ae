package com.openfashion.lendingservice.model;

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
@Table(name = "balances", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"account_id", "kind"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Balance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private BalanceKind kind;

    @Column(nullable = false)
    @PositiveOrZero
    private long amount;

    @Column(nullable = false)
    @Version
    private long version;

    @UpdateTimestamp
    private Instant updatedAt;
}
