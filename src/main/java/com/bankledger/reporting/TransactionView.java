package com.bankledger.reporting;

import com.bankledger.common.Money;
import lombok.Value;

/**
 * One row of an account's transaction history.
 */
@Value
public class TransactionView {
    String timestamp;
    String type;
    Money amount;
    String details;
}
