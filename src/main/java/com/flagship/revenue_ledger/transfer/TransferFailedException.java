package com.flagship.revenue_ledger.transfer;

import com.flagship.revenue_ledger.exception.ErrorCategory;
import com.flagship.revenue_ledger.exception.RevenueLedgerException;

public class TransferFailedException extends RevenueLedgerException {

    public TransferFailedException(TransferInstruction instruction, Throwable cause) {
        super(ErrorCategory.TRANSFER_FAILED,
                String.format("Transfer of %s from ledger %s to %s failed: %s",
                        instruction.getAmount(), instruction.getLedgerAddress(), instruction.getRecipient(),
                        cause.getMessage()),
                details("ledger", instruction.getLedgerAddress(),
                        "claimant", instruction.getRecipient(),
                        "amount", instruction.getAmount()),
                cause);
    }
}
