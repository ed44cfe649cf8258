package com.bankledger.ledger;

import com.bankledger.common.Money;

import java.util.EnumSet;
import java.util.Set;

/**
 * Plain cash movement with no counterparty: initial deposit, deposit or withdrawal.
 */
public class CashTransaction extends Transaction {

    private static final Set<TransactionType> TYPES = EnumSet.of(
        TransactionType.INITIAL_DEPOSIT,
        TransactionType.DEPOSIT,
        TransactionType.WITHDRAWAL
    );

    public CashTransaction(String timestamp, TransactionType type, Money amount) {
        super(timestamp, type, amount);
        if (!TYPES.contains(type)) {
            throw new IllegalArgumentException("Not a cash transaction type: " + type);
        }
    }
}
