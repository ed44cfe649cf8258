package com.bankledger.common.exception;

/**
 * Base exception for all bank ledger exceptions.
 */
public class BankLedgerException extends RuntimeException {

    public BankLedgerException(String message) {
        super(message);
    }

    public BankLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
