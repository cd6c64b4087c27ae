package com.openfashion.ammservice.repository;

import com.openfashion.ammservice.model.AccountPools;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountPoolsRepository extends JpaRepository<AccountPools, String> {
}
