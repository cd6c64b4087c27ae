package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.FarmingPool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FarmingPoolRepository extends JpaRepository<FarmingPool, Long> {
}
