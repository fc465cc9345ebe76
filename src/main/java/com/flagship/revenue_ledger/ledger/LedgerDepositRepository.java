package com.flagship.revenue_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerDepositRepository extends JpaRepository<LedgerDepositEntity, UUID> {

    Optional<LedgerDepositEntity> findByLedgerAddressAndIdempotencyKey(String ledgerAddress, String idempotencyKey);

    long countByLedgerAddress(String ledgerAddress);
}
