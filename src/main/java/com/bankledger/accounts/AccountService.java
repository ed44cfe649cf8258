package com.bankledger.accounts;

import com.bankledger.common.Money;
import com.bankledger.common.Timestamps;
import com.bankledger.common.exception.AccountNotFoundException;
import com.bankledger.common.exception.UserNotFoundException;
import com.bankledger.common.exception.ValidationException;
import com.bankledger.ledger.Transaction;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.LedgerTables;
import com.bankledger.store.WriteResult;
import com.bankledger.users.CustomerUser;
import com.bankledger.users.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Service for opening and looking up accounts.
 */
@Service
@Slf4j
public class AccountService {

    private final LedgerStore store;
    private final Clock clock;
    private final Money minInitialDeposit;

    public AccountService(
            LedgerStore store,
            Clock clock,
            @Value("${bank-ledger.accounts.min-initial-deposit:0.00}") BigDecimal minInitialDeposit) {
        this.store = store;
        this.clock = clock;
        this.minInitialDeposit = Money.of(minInitialDeposit);
    }

    /**
     * Opens an account for a customer under the next free account number. A positive
     * initial deposit is recorded as an "Initial Deposit" transaction.
     */
    public WriteResult<Account> openAccount(String ownerNic, Money initialDeposit) {
        Money deposit = initialDeposit == null ? Money.zero() : initialDeposit;
        if (deposit.isNegative() || deposit.isLessThan(minInitialDeposit)) {
            throw new ValidationException("initialDeposit",
                "Initial deposit must be at least " + minInitialDeposit.format());
        }

        LedgerTables tables = store.tables();
        User owner = tables.findUser(ownerNic)
            .orElseThrow(() -> new UserNotFoundException(ownerNic));
        if (!(owner instanceof CustomerUser)) {
            throw new ValidationException("ownerNic", "Only customers can own accounts: " + ownerNic);
        }

        String createdAt = Timestamps.now(clock);
        Account account = Account.open(tables.allocateAccountNumber(), ownerNic, createdAt);
        if (deposit.isPositive()) {
            account.apply(Transaction.initialDeposit(createdAt, deposit));
        }

        tables.putAccount(account);
        ((CustomerUser) owner).addOwnedAccount(account.getAccountNumber());

        log.info("Opened account {} for owner {} with balance {}",
            account.getAccountNumber(), ownerNic, account.getBalance());

        return WriteResult.of(account, store.commit());
    }

    public Account getAccount(String accountNumber) {
        return store.tables().findAccount(accountNumber)
            .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }

    /**
     * Resolves an account only if it is listed as owned by the given customer.
     */
    public Account findOwnedAccount(String ownerNic, String accountNumber) {
        Optional<User> owner = store.tables().findUser(ownerNic);
        boolean listed = owner.isPresent()
            && owner.get() instanceof CustomerUser
            && ((CustomerUser) owner.get()).owns(accountNumber);
        if (!listed) {
            throw new AccountNotFoundException(accountNumber);
        }
        return getAccount(accountNumber);
    }

    /**
     * Accounts of a customer in opening order. Dangling entries are left out.
     */
    public List<Account> getAccountsByOwner(String ownerNic) {
        User owner = store.tables().findUser(ownerNic)
            .orElseThrow(() -> new UserNotFoundException(ownerNic));
        if (!(owner instanceof CustomerUser)) {
            return List.of();
        }
        return ((CustomerUser) owner).getOwnedAccounts().stream()
            .map(store.tables()::findAccount)
            .flatMap(Optional::stream)
            .toList();
    }
}
