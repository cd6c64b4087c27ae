package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.LiquidityPool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LiquidityPoolRepository extends JpaRepository<LiquidityPool, Long> {
}
