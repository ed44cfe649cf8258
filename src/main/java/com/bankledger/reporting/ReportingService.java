package com.bankledger.reporting;

import com.bankledger.accounts.Account;
import com.bankledger.common.Money;
import com.bankledger.common.exception.AccountNotFoundException;
import com.bankledger.ledger.InterestTransaction;
import com.bankledger.ledger.Transaction;
import com.bankledger.ledger.TransferTransaction;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.LedgerTables;
import com.bankledger.users.CustomerUser;
import com.bankledger.users.User;
import com.bankledger.users.UserRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Read-only listings over the in-memory tables for the session layer to display.
 */
@Service
@RequiredArgsConstructor
public class ReportingService {

    private final LedgerStore store;

    public List<UserSummary> listUsers() {
        return store.tables().users().stream()
            .map(user -> new UserSummary(user.getNic(), user.getName(), user.getRole(),
                user instanceof CustomerUser ? ((CustomerUser) user).getOwnedAccounts() : List.of()))
            .toList();
    }

    public List<AccountSummary> listAccounts() {
        LedgerTables tables = store.tables();
        return tables.accounts().stream()
            .map(account -> new AccountSummary(
                account.getAccountNumber(),
                account.getOwnerNic(),
                tables.findUser(account.getOwnerNic()).map(User::getName).orElse("N/A"),
                account.getBalance(),
                account.getCreatedAt()))
            .toList();
    }

    /**
     * Customers as {@code "nic: name"} entries, in registration order.
     */
    public List<String> customerDirectory() {
        return store.tables().users().stream()
            .filter(user -> user.getRole() == UserRole.CUSTOMER)
            .map(user -> user.getNic() + ": " + user.getName())
            .toList();
    }

    public Money balance(String accountNumber) {
        return findAccount(accountNumber).getBalance();
    }

    public List<TransactionView> transactionHistory(String accountNumber) {
        return findAccount(accountNumber).getTransactions().stream()
            .map(transaction -> new TransactionView(
                transaction.getTimestamp(),
                transaction.getType().getLabel(),
                transaction.getAmount(),
                describe(transaction)))
            .toList();
    }

    private Account findAccount(String accountNumber) {
        return store.tables().findAccount(accountNumber)
            .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }

    static String describe(Transaction transaction) {
        if (transaction instanceof TransferTransaction) {
            TransferTransaction transfer = (TransferTransaction) transaction;
            return (transfer.isSent() ? "To Acct: " : "From Acct: ") + transfer.getCounterpartyAccount();
        }
        if (transaction instanceof InterestTransaction) {
            BigDecimal percent = ((InterestTransaction) transaction).getRate()
                .movePointRight(2)
                .setScale(2, RoundingMode.HALF_UP);
            return "Rate: " + percent.toPlainString() + "% p.a.";
        }
        return "N/A";
    }
}
