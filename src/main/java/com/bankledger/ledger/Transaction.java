package com.bankledger.ledger;

import com.bankledger.common.Money;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Immutable entry in an account's transaction log.
 *
 * Amounts are stored unsigned; the direction comes from the {@link TransactionType}.
 * The set of variants is closed: {@link CashTransaction}, {@link TransferTransaction}
 * and {@link InterestTransaction}.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class Transaction {

    private final String timestamp;
    private final TransactionType type;
    private final Money amount;

    protected Transaction(String timestamp, TransactionType type, Money amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Transaction amount cannot be null");
        }
        this.timestamp = timestamp;
        this.type = type;
        this.amount = amount;
    }

    public static Transaction initialDeposit(String timestamp, Money amount) {
        return new CashTransaction(timestamp, TransactionType.INITIAL_DEPOSIT, amount);
    }

    public static Transaction deposit(String timestamp, Money amount) {
        return new CashTransaction(timestamp, TransactionType.DEPOSIT, amount);
    }

    public static Transaction withdrawal(String timestamp, Money amount) {
        return new CashTransaction(timestamp, TransactionType.WITHDRAWAL, amount);
    }

    public static TransferTransaction transferSent(String timestamp, Money amount, String toAccount) {
        return new TransferTransaction(timestamp, TransactionType.TRANSFER_SENT, amount, toAccount);
    }

    public static TransferTransaction transferReceived(String timestamp, Money amount, String fromAccount) {
        return new TransferTransaction(timestamp, TransactionType.TRANSFER_RECEIVED, amount, fromAccount);
    }

    public static InterestTransaction interestApplied(String timestamp, Money amount, BigDecimal rate) {
        return new InterestTransaction(timestamp, amount, rate);
    }

    /**
     * Effect on the balance: positive for credits, negative for debits.
     */
    public Money getSignedAmount() {
        return type.getEntryType() == TransactionType.EntryType.CREDIT ? amount : amount.negate();
    }
}
