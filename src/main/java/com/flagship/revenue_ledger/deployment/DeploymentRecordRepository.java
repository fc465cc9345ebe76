package com.flagship.revenue_ledger.deployment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeploymentRecordRepository extends JpaRepository<DeploymentRecordEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DeploymentRecordEntity d WHERE d.roundId = :roundId")
    Optional<DeploymentRecordEntity> findByRoundIdForUpdate(@Param("roundId") UUID roundId);

    long countByStatus(DeploymentStatus status);
}
