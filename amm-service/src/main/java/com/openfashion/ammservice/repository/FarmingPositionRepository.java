package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.FarmingPosition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FarmingPositionRepository extends JpaRepository<FarmingPosition, UUID> {

    Optional<FarmingPosition> findByPoolIdAndAccountId(long poolId, String accountId);
}
