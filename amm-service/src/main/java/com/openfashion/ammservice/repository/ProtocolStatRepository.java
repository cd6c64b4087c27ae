package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.ProtocolStat;
import com.openfashion.ammservice.model.StatKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProtocolStatRepository extends JpaRepository<ProtocolStat, String> {

    default long valueOf(StatKey key) {
        return findById(key.name())
                .map(ProtocolStat::getValue)
                .orElse(0L);
    }
}
