package com.bankledger.ledger;

import com.bankledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Summary of one interest accrual pass over all accounts.
 */
@Value
public class InterestRun {
    int accountsCredited;
    Money totalInterest;
    BigDecimal rate;
}
