package com.bankledger.ledger;

import com.bankledger.common.Money;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One side of a transfer. The counterparty is the receiving account for
 * {@link TransactionType#TRANSFER_SENT} and the sending account for
 * {@link TransactionType#TRANSFER_RECEIVED}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TransferTransaction extends Transaction {

    private final String counterpartyAccount;

    public TransferTransaction(String timestamp, TransactionType type, Money amount, String counterpartyAccount) {
        super(timestamp, type, amount);
        if (type != TransactionType.TRANSFER_SENT && type != TransactionType.TRANSFER_RECEIVED) {
            throw new IllegalArgumentException("Not a transfer transaction type: " + type);
        }
        if (counterpartyAccount == null || counterpartyAccount.isEmpty()) {
            throw new IllegalArgumentException("Transfer requires a counterparty account");
        }
        this.counterpartyAccount = counterpartyAccount;
    }

    public boolean isSent() {
        return getType() == TransactionType.TRANSFER_SENT;
    }
}
