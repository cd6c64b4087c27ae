package com.openfashion.ammservice.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered pool memberships of one account. Capacity is enforced by the pool service.
 */
@Entity
@Table(name = "account_pools")
@Data
@NoArgsConstructor
public class AccountPools {

    @Id
    private String accountId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_pool_ids", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "pool_id", nullable = false)
    private List<Long> poolIds = new ArrayList<>();

    @Version
    private Long version;

    public AccountPools(String accountId) {
        this.accountId = accountId;
    }
}
