package com.flagship.revenue_ledger.deployment;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DeploymentShareEmbeddable {

    @Column(name = "claimant_address", nullable = false, length = 42)
    private String claimantAddress;

    @Column(name = "shares", nullable = false)
    private int shares;
}
