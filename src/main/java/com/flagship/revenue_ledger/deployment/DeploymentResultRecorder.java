package com.flagship.revenue_ledger.deployment;

/**
 * Callback for components that track the round a deployment belongs to.
 *
 * Invoked after every outcome is committed: by {@code deploy}, {@code retry}
 * and {@code reconcile}. Implementations must be idempotent.
 */
public interface DeploymentResultRecorder {

    void recordDeploymentResult(DeploymentResult result);
}
