package com.bankledger.common.exception;

/**
 * Thrown when the data files cannot be brought into a usable state,
 * e.g. the first-run admin could not be created or written.
 */
public class PersistenceException extends BankLedgerException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
