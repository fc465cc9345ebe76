package com.flagship.revenue_ledger.transfer;

import lombok.Value;

import java.math.BigInteger;

/**
 * Move {@code amount} smallest units out of a ledger's pool to a claimant.
 */
@Value
public class TransferInstruction {
    String ledgerAddress;
    String recipient;
    BigInteger amount;
}
