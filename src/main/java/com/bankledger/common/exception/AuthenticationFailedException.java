package com.bankledger.common.exception;

/**
 * Thrown when every allowed password attempt for a login was wrong.
 */
public class AuthenticationFailedException extends BankLedgerException {

    private final int attempts;

    public AuthenticationFailedException(String nic, int attempts) {
        super(String.format("Authentication failed for %s after %d attempts", nic, attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
