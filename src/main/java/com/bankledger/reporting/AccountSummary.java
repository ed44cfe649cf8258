package com.bankledger.reporting;

import com.bankledger.common.Money;
import lombok.Value;

/**
 * One row of the account listing. The owner name is "N/A" when the owner is unknown.
 */
@Value
public class AccountSummary {
    String accountNumber;
    String ownerNic;
    String ownerName;
    Money balance;
    String createdAt;
}
