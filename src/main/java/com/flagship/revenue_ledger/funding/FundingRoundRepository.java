package com.flagship.revenue_ledger.funding;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FundingRoundRepository extends JpaRepository<FundingRoundEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM FundingRoundEntity r WHERE r.id = :id")
    Optional<FundingRoundEntity> findByIdForUpdate(@Param("id") UUID id);
}
