package com.flagship.revenue_ledger.deployment;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Validated provisioner inputs. {@code payees} and {@code shares} are
 * parallel lists; {@code cap} is a decimal string in settlement units.
 */
@Value
public class ProvisioningRequest {
    UUID roundId;
    String owner;
    List<String> payees;
    List<Integer> shares;
    String cap;
}
