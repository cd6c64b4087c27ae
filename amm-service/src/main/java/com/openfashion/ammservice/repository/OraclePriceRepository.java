package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.OraclePrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OraclePriceRepository extends JpaRepository<OraclePrice, String> {
}
