package com.bankledger.ledger;

import com.bankledger.common.Money;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Interest credit together with the annual rate used to compute it.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class InterestTransaction extends Transaction {

    private final BigDecimal rate;

    public InterestTransaction(String timestamp, Money amount, BigDecimal rate) {
        super(timestamp, TransactionType.INTEREST_APPLIED, amount);
        if (rate == null) {
            throw new IllegalArgumentException("Interest transaction requires a rate");
        }
        this.rate = rate;
    }
}
