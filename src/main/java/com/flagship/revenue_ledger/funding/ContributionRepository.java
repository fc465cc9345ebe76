package com.flagship.revenue_ledger.funding;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<ContributionEntity, Long> {

    List<ContributionEntity> findByRoundIdOrderByIdAsc(UUID roundId);
}
