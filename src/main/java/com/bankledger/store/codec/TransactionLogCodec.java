package com.bankledger.store.codec;

import com.bankledger.common.Money;
import com.bankledger.ledger.InterestTransaction;
import com.bankledger.ledger.Transaction;
import com.bankledger.ledger.TransactionType;
import com.bankledger.ledger.TransferTransaction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Serializes an account's transaction log as a single-line JSON array.
 *
 * Decoding is lenient: anything that does not read as a JSON array of objects yields an
 * empty log, and individual elements that do not describe a known transaction are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionLogCodec {

    private static final TypeReference<List<TransactionRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String encode(List<Transaction> transactions) {
        List<TransactionRecord> records = transactions.stream()
            .map(TransactionLogCodec::toRecord)
            .toList();
        try {
            return objectMapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            // Records hold only strings and decimals
            throw new IllegalStateException("Unable to serialize transaction log", e);
        }
    }

    /**
     * Binds the JSON array directly to records, so decimals keep the scale they were written
     * with ({@code 0.10} stays {@code 0.10}).
     */
    public List<Transaction> decode(String json, String accountNumber) {
        List<TransactionRecord> records;
        try {
            records = objectMapper.readValue(json, RECORD_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Could not read transactions for account {} ({}); using an empty log",
                accountNumber, e.getOriginalMessage());
            return new ArrayList<>();
        }
        if (records == null) {
            log.warn("Transactions for account {} are not a list; using an empty log", accountNumber);
            return new ArrayList<>();
        }

        List<Transaction> transactions = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            Optional<Transaction> transaction = fromRecord(records.get(i));
            if (transaction.isPresent()) {
                transactions.add(transaction.get());
            } else {
                log.warn("Dropping unreadable transaction #{} of account {}", i + 1, accountNumber);
            }
        }
        return transactions;
    }

    static TransactionRecord toRecord(Transaction transaction) {
        TransactionRecord.TransactionRecordBuilder builder = TransactionRecord.builder()
            .timestamp(transaction.getTimestamp())
            .type(transaction.getType().getLabel())
            .amount(transaction.getAmount().getAmount());

        switch (transaction.getType()) {
            case TRANSFER_SENT -> builder.toAccount(((TransferTransaction) transaction).getCounterpartyAccount());
            case TRANSFER_RECEIVED -> builder.fromAccount(((TransferTransaction) transaction).getCounterpartyAccount());
            case INTEREST_APPLIED -> builder.rate(((InterestTransaction) transaction).getRate());
            default -> {
            }
        }
        return builder.build();
    }

    static Optional<Transaction> fromRecord(TransactionRecord record) {
        if (record == null || record.getAmount() == null) {
            return Optional.empty();
        }
        Optional<TransactionType> type = TransactionType.fromLabel(record.getType());
        if (type.isEmpty()) {
            return Optional.empty();
        }

        String timestamp = record.getTimestamp();
        Money amount = Money.of(record.getAmount());

        return switch (type.get()) {
            case INITIAL_DEPOSIT -> Optional.of(Transaction.initialDeposit(timestamp, amount));
            case DEPOSIT -> Optional.of(Transaction.deposit(timestamp, amount));
            case WITHDRAWAL -> Optional.of(Transaction.withdrawal(timestamp, amount));
            case TRANSFER_SENT -> isBlank(record.getToAccount())
                ? Optional.empty()
                : Optional.of(Transaction.transferSent(timestamp, amount, record.getToAccount()));
            case TRANSFER_RECEIVED -> isBlank(record.getFromAccount())
                ? Optional.empty()
                : Optional.of(Transaction.transferReceived(timestamp, amount, record.getFromAccount()));
            case INTEREST_APPLIED -> record.getRate() == null
                ? Optional.empty()
                : Optional.of(Transaction.interestApplied(timestamp, amount, record.getRate()));
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
