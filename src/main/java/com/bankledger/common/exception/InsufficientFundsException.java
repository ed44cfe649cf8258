package com.bankledger.common.exception;

import com.bankledger.common.Money;

/**
 * Thrown when an account has insufficient funds for a withdrawal or transfer.
 */
public class InsufficientFundsException extends BankLedgerException {

    private final String accountNumber;
    private final Money requested;
    private final Money available;

    public InsufficientFundsException(String accountNumber, Money requested, Money available) {
        super(String.format("Insufficient funds in account %s. Requested: %s, Available: %s",
            accountNumber, requested.format(), available.format()));
        this.accountNumber = accountNumber;
        this.requested = requested;
        this.available = available;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public Money getRequested() {
        return requested;
    }

    public Money getAvailable() {
        return available;
    }
}
