package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.SwapRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SwapRecordRepository extends JpaRepository<SwapRecord, Long> {

    List<SwapRecord> findAllByPoolIdOrderById(long poolId);
}
