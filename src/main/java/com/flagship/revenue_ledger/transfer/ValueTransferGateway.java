package com.flagship.revenue_ledger.transfer;

import java.math.BigInteger;
import java.util.UUID;

/**
 * The "send value to address" primitive used by ledger releases.
 *
 * A transfer either fully succeeds and returns a receipt, or fully fails by
 * throwing. Implementations are called inside the release transaction while
 * the ledger row is locked, so a failure rolls back the bookkeeping too.
 */
public interface ValueTransferGateway {

    /**
     * @throws TransferFailedException if no value was delivered
     */
    TransferReceipt transfer(TransferInstruction instruction);

    /**
     * Books revenue received by a ledger, the source later payouts draw from.
     * Called inside the deposit transaction.
     */
    void recordDeposit(String ledgerAddress, BigInteger amount, UUID depositId);
}
