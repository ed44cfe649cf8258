package com.bankledger.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends BankLedgerException {

    public AccountNotFoundException(String accountNumber) {
        super("Account not found: " + accountNumber);
    }
}
