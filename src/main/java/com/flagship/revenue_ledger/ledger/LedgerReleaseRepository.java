package com.flagship.revenue_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface LedgerReleaseRepository extends JpaRepository<LedgerReleaseEntity, UUID> {

    long countByLedgerAddressAndClaimantAddress(String ledgerAddress, String claimantAddress);
}
