package com.bankledger.common.exception;

/**
 * Thrown when registering a NIC that is already taken.
 */
public class DuplicateUserException extends BankLedgerException {

    public DuplicateUserException(String nic) {
        super("A user with NIC '" + nic + "' already exists");
    }
}
