package com.bankledger.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Immutable fixed-point currency amount.
 * Always carries two decimal places so equal amounts compare and print identically.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money implements Comparable<Money> {

    public static final int SCALE = 2;

    private static final String SYMBOL = "$";

    BigDecimal amount;

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount.setScale(SCALE, RoundingMode.HALF_UP));
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static Money zero() {
        return of(BigDecimal.ZERO);
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    /**
     * Multiplies by a rate and rounds half-up to cents.
     */
    public Money multiply(BigDecimal multiplier) {
        return new Money(this.amount.multiply(multiplier).setScale(SCALE, RoundingMode.HALF_UP));
    }

    public boolean isGreaterThan(Money other) {
        return this.amount.compareTo(other.amount) > 0;
    }

    public boolean isLessThan(Money other) {
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    public boolean isZero() {
        return this.amount.signum() == 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    /**
     * Plain decimal form used in the data files, e.g. {@code 1234.50}.
     */
    public String toPlainString() {
        return amount.toPlainString();
    }

    /**
     * Display form with symbol and thousands separators, e.g. {@code $1,234.50}.
     */
    public String format() {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        return SYMBOL + format.format(amount);
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return format();
    }
}
