package com.openfashion.lendingservice.repository;

import com.openfashion.lendingservice.model.Balance;
import com.openfashion.lendingservice.model.BalanceKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BalanceRepository extends JpaRepository<Balance, UUID> {

    Optional<Balance> findByAccountIdAndKind(String accountId, BalanceKind kind);

    /**
     * Absent balances read as zero.
     */
    default long balanceOf(String accountId, BalanceKind kind) {
        return findByAccountIdAndKind(accountId, kind)
                .map(Balance::getAmount)
                .orElse(0L);
    }
}
