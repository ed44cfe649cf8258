package com.bankledger.common.exception;

/**
 * Thrown when a user is not found.
 */
public class UserNotFoundException extends BankLedgerException {

    public UserNotFoundException(String nic) {
        super("User not found: " + nic);
    }
}
