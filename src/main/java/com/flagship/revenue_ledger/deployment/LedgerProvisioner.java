package com.flagship.revenue_ledger.deployment;

/**
 * Materializes a new ledger outside this service and reports its address.
 *
 * Implementations never throw for provisioning problems; they classify the
 * outcome instead. {@link ProvisioningOutcome.Kind#AMBIGUOUS} must be used
 * whenever a ledger might have been created without its address being captured.
 */
public interface LedgerProvisioner {

    ProvisioningOutcome provision(ProvisioningRequest request);
}
