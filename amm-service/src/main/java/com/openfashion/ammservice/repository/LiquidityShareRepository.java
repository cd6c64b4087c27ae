package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.LiquidityShare;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LiquidityShareRepository extends JpaRepository<LiquidityShare, UUID> {

    Optional<LiquidityShare> findByPoolIdAndProvider(long poolId, String provider);

    @Query("SELECT COALESCE(SUM(s.shares), 0) FROM LiquidityShare s WHERE s.poolId = :poolId")
    long sumSharesByPoolId(@Param("poolId") long poolId);

    default long sharesOf(long poolId, String provider) {
        return findByPoolIdAndProvider(poolId, provider)
                .map(LiquidityShare::getShares)
                .orElse(0L);
    }
}
