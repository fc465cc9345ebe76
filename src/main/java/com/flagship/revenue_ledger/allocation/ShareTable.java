package com.flagship.revenue_ledger.allocation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping from claimant to basis-point shares.
 *
 * Construction rejects empty tables, duplicate claimants and non-positive
 * shares. Whether the shares add up to {@link #TOTAL_SHARES} is reported by
 * {@link #isBalanced()} rather than enforced here, so that a table received
 * from outside can be inspected and rejected with a precise error.
 *
 * Invariant for any table attached to a ledger: {@code totalShares() == 10000}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ShareTable {

    public static final int TOTAL_SHARES = 10_000;

    List<ClaimantShare> entries;

    public static ShareTable of(List<ClaimantShare> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Share table must have at least one claimant");
        }
        Set<String> seen = new HashSet<>();
        for (ClaimantShare entry : entries) {
            if (entry == null || entry.getClaimant() == null || entry.getClaimant().isBlank()) {
                throw new IllegalArgumentException("Share table entries must name a claimant");
            }
            if (entry.getShares() <= 0) {
                throw new IllegalArgumentException(
                    String.format("Shares must be positive: claimant=%s, shares=%d",
                        entry.getClaimant(), entry.getShares()));
            }
            if (!seen.add(entry.getClaimant())) {
                throw new IllegalArgumentException("Duplicate claimant in share table: " + entry.getClaimant());
            }
        }
        return new ShareTable(List.copyOf(entries));
    }

    public int totalShares() {
        return entries.stream().mapToInt(ClaimantShare::getShares).sum();
    }

    public boolean isBalanced() {
        return totalShares() == TOTAL_SHARES;
    }

    public Optional<Integer> sharesOf(String claimant) {
        return entries.stream()
            .filter(entry -> entry.getClaimant().equals(claimant))
            .map(ClaimantShare::getShares)
            .findFirst();
    }

    public boolean contains(String claimant) {
        return sharesOf(claimant).isPresent();
    }

    public List<String> claimants() {
        return entries.stream().map(ClaimantShare::getClaimant).toList();
    }

    public List<Integer> shares() {
        return entries.stream().map(ClaimantShare::getShares).toList();
    }

    public int size() {
        return entries.size();
    }
}
