package com.bankledger.common.exception;

/**
 * Thrown when caller input has the wrong shape: empty or reserved-character identifiers,
 * malformed dates, weak passwords, non-positive amounts.
 */
public class ValidationException extends BankLedgerException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
