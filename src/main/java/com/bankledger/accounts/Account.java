package com.bankledger.accounts;

import com.bankledger.common.Money;
import com.bankledger.common.exception.InsufficientFundsException;
import com.bankledger.ledger.Transaction;
import com.bankledger.ledger.TransactionType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bank account: balance plus an append-only transaction log.
 *
 * The balance only changes through {@link #apply(Transaction)}, which records the
 * transaction in the same step, so the balance always equals the opening balance plus
 * the signed sum of the log.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Account {

    private final String accountNumber;
    private final String ownerNic;
    private final String createdAt;

    private Money balance;

    @Getter(lombok.AccessLevel.NONE)
    private final List<Transaction> transactions;

    public Account(String accountNumber, String ownerNic, Money balance, String createdAt,
                   List<Transaction> transactions) {
        this.accountNumber = accountNumber;
        this.ownerNic = ownerNic;
        this.balance = balance == null ? Money.zero() : balance;
        this.createdAt = createdAt;
        this.transactions = transactions == null ? new ArrayList<>() : new ArrayList<>(transactions);
    }

    /**
     * Creates an account with a zero balance and an empty log.
     */
    public static Account open(String accountNumber, String ownerNic, String createdAt) {
        return new Account(accountNumber, ownerNic, Money.zero(), createdAt, List.of());
    }

    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Posts a transaction: adjusts the balance by its signed amount and appends it to the log.
     *
     * @throws InsufficientFundsException if a debit exceeds the current balance
     */
    public void apply(Transaction transaction) {
        if (transaction.getType().getEntryType() == TransactionType.EntryType.DEBIT
            && transaction.getAmount().isGreaterThan(balance)) {
            throw new InsufficientFundsException(accountNumber, transaction.getAmount(), balance);
        }
        this.balance = balance.add(transaction.getSignedAmount());
        this.transactions.add(transaction);
    }

    public boolean isOwnedBy(String nic) {
        return ownerNic != null && ownerNic.equals(nic);
    }
}
