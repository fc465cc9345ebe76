package com.flagship.revenue_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntity, String> {

    /**
     * Loads a ledger with SELECT ... FOR UPDATE.
     * Every mutating ledger operation goes through here, which serialises
     * deposits and releases per ledger across threads and instances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LedgerEntity l WHERE l.address = :address")
    Optional<LedgerEntity> findByAddressForUpdate(@Param("address") String address);

    Optional<LedgerEntity> findByRoundId(UUID roundId);

    boolean existsByRoundId(UUID roundId);
}
