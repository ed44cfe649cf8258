package com.bankledger.store.codec;

import com.bankledger.accounts.Account;
import com.bankledger.common.Money;
import com.bankledger.ledger.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts accounts to and from lines of the accounts file.
 *
 * Line layout, fields joined by {@link RecordDelimiters#FIELD}:
 * {@code account_number, owner_nic, balance, created_at, transactions_json}.
 *
 * An unreadable balance decodes as zero and an unreadable transaction log as an empty
 * list; the rest of the record is kept. Both cases are logged at warn level because they
 * discard financial data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountRecordCodec {

    static final int FIELD_COUNT = 5;

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d{1,3})?");

    private final TransactionLogCodec transactionLogCodec;

    public String encode(Account account) {
        return String.join(RecordDelimiters.FIELD,
            account.getAccountNumber(),
            account.getOwnerNic() == null ? "" : account.getOwnerNic(),
            account.getBalance().toPlainString(),
            account.getCreatedAt() == null ? "" : account.getCreatedAt(),
            transactionLogCodec.encode(account.getTransactions()));
    }

    /**
     * Parses one line. Returns empty for a malformed line so the caller can skip it.
     */
    public Optional<Account> decode(String line) {
        String[] parts = RecordDelimiters.splitFields(line.strip());
        if (parts.length != FIELD_COUNT) {
            log.debug("Malformed account line: expected {} fields, got {}", FIELD_COUNT, parts.length);
            return Optional.empty();
        }

        String accountNumber = parts[0];
        if (accountNumber.isEmpty()) {
            log.debug("Malformed account line: empty account number");
            return Optional.empty();
        }

        Money balance = parseBalance(parts[2]).orElseGet(() -> {
            log.warn("Invalid balance '{}' for account {}; defaulting to {}", parts[2], accountNumber, Money.zero());
            return Money.zero();
        });
        List<Transaction> transactions = transactionLogCodec.decode(parts[4], accountNumber);

        return Optional.of(new Account(accountNumber, parts[1], balance, parts[3], transactions));
    }

    static Optional<Money> parseBalance(String value) {
        String trimmed = value.strip();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(Money.of(new BigDecimal(trimmed)));
    }
}
