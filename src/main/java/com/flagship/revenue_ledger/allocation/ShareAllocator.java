package com.flagship.revenue_ledger.allocation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts contribution amounts into basis-point shares.
 *
 * Algorithm:
 * 1. share = round(amount / total * 10000), HALF_UP
 * 2. drift = 10000 - sum(shares)
 * 3. drift is added to the largest contributor (first occurrence wins ties)
 *
 * Guarantees sum(shares) == 10000 and every share > 0. Only the largest
 * contributor's share is touched by the correction.
 */
@Component
@Slf4j
public class ShareAllocator {

    private static final BigDecimal TOTAL = BigDecimal.valueOf(ShareTable.TOTAL_SHARES);

    /**
     * Allocates shares for a list of distinct claimants.
     *
     * Each entry is treated as its own claimant; callers must aggregate
     * repeated contributions first (see {@link #aggregate(List)}).
     *
     * @param contributions ordered, non-empty list with positive amounts
     * @return share table in input order, summing to exactly 10000
     * @throws EmptyContributionsException if the list is empty
     * @throws DegenerateAllocationException if a claimant would get no shares
     * @throws IllegalArgumentException on non-positive amounts or duplicate claimants
     */
    public ShareTable allocate(List<Contribution> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            throw new EmptyContributionsException();
        }
        validate(contributions);

        BigDecimal total = contributions.stream()
            .map(Contribution::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        int[] shares = new int[contributions.size()];
        int largest = 0;
        int allocated = 0;
        for (int i = 0; i < contributions.size(); i++) {
            BigDecimal amount = contributions.get(i).getAmount();
            shares[i] = amount.multiply(TOTAL).divide(total, 0, RoundingMode.HALF_UP).intValueExact();
            allocated += shares[i];
            if (amount.compareTo(contributions.get(largest).getAmount()) > 0) {
                largest = i;
            }
        }

        int drift = ShareTable.TOTAL_SHARES - allocated;
        if (drift != 0) {
            log.debug("Correcting rounding drift: drift={}, claimant={}",
                drift, contributions.get(largest).getClaimantId());
            shares[largest] += drift;
        }

        List<ClaimantShare> entries = new ArrayList<>(contributions.size());
        for (int i = 0; i < contributions.size(); i++) {
            Contribution contribution = contributions.get(i);
            if (shares[i] <= 0) {
                throw new DegenerateAllocationException(
                    contribution.getClaimantId(), contribution.getAmount(), shares[i]);
            }
            entries.add(ClaimantShare.of(contribution.getClaimantId(), shares[i]));
        }
        return ShareTable.of(entries);
    }

    /**
     * Sums repeated contributions from the same identity, keeping the order
     * in which each identity first appeared.
     */
    public static List<Contribution> aggregate(List<Contribution> contributions) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (Contribution contribution : contributions) {
            totals.merge(contribution.getClaimantId(), contribution.getAmount(), BigDecimal::add);
        }
        return totals.entrySet().stream()
            .map(entry -> Contribution.of(entry.getKey(), entry.getValue()))
            .toList();
    }

    private void validate(List<Contribution> contributions) {
        Set<String> seen = new HashSet<>();
        for (Contribution contribution : contributions) {
            if (contribution.getClaimantId() == null || contribution.getClaimantId().isBlank()) {
                throw new IllegalArgumentException("Contribution must name a claimant");
            }
            if (contribution.getAmount() == null || contribution.getAmount().signum() <= 0) {
                throw new IllegalArgumentException(
                    String.format("Contribution amount must be positive: claimant=%s, amount=%s",
                        contribution.getClaimantId(), contribution.getAmount()));
            }
            if (!seen.add(contribution.getClaimantId())) {
                throw new IllegalArgumentException(
                    "Contributions must be aggregated per claimant, duplicate: " + contribution.getClaimantId());
            }
        }
    }
}
