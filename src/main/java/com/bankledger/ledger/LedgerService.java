package com.bankledger.ledger;

import com.bankledger.accounts.Account;
import com.bankledger.common.Money;
import com.bankledger.common.Timestamps;
import com.bankledger.common.exception.AccountNotFoundException;
import com.bankledger.common.exception.InsufficientFundsException;
import com.bankledger.common.exception.ValidationException;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.SaveResult;
import com.bankledger.store.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Service for moving money: deposits, withdrawals, transfers and interest accrual.
 *
 * Every operation validates first and mutates only once all checks pass, so a rejected
 * operation changes nothing and saves nothing. A successful one is saved immediately.
 */
@Service
@Slf4j
public class LedgerService {

    private final LedgerStore store;
    private final Clock clock;
    private final BigDecimal defaultInterestRate;

    public LedgerService(
            LedgerStore store,
            Clock clock,
            @Value("${bank-ledger.interest.annual-rate:0.015}") BigDecimal defaultInterestRate) {
        this.store = store;
        this.clock = clock;
        this.defaultInterestRate = defaultInterestRate;
    }

    public WriteResult<Transaction> deposit(String accountNumber, Money amount) {
        requirePositive(amount, "Deposit");
        Account account = findAccount(accountNumber);

        Transaction deposit = Transaction.deposit(Timestamps.now(clock), amount);
        account.apply(deposit);

        log.info("Deposited {} to account {}; balance {}", amount, accountNumber, account.getBalance());
        return WriteResult.of(deposit, store.commit());
    }

    /**
     * @throws InsufficientFundsException if the amount exceeds the balance
     */
    public WriteResult<Transaction> withdraw(String accountNumber, Money amount) {
        Account account = findAccount(accountNumber);
        if (account.getBalance().isZero()) {
            throw new InsufficientFundsException(accountNumber, amount == null ? Money.zero() : amount,
                account.getBalance());
        }
        requirePositive(amount, "Withdrawal");
        requireFunds(account, amount);

        Transaction withdrawal = Transaction.withdrawal(Timestamps.now(clock), amount);
        account.apply(withdrawal);

        log.info("Withdrew {} from account {}; balance {}", amount, accountNumber, account.getBalance());
        return WriteResult.of(withdrawal, store.commit());
    }

    /**
     * Moves funds between two distinct accounts. Both sides are checked before either is
     * touched, and each side records a transaction naming the other account.
     *
     * @throws ValidationException for a self-transfer or non-positive amount
     * @throws AccountNotFoundException if either account does not exist
     * @throws InsufficientFundsException if the amount exceeds the source balance
     */
    public WriteResult<TransferRecord> transfer(String sourceAccountNumber, String destinationAccountNumber,
                                                Money amount) {
        if (destinationAccountNumber == null || destinationAccountNumber.isBlank()) {
            throw new ValidationException("destinationAccount", "Recipient account number cannot be empty");
        }
        if (destinationAccountNumber.equals(sourceAccountNumber)) {
            throw new ValidationException("destinationAccount", "Cannot transfer funds to the same account");
        }
        Account source = findAccount(sourceAccountNumber);
        Account destination = findAccount(destinationAccountNumber);
        requirePositive(amount, "Transfer");
        requireFunds(source, amount);

        String timestamp = Timestamps.now(clock);
        TransferTransaction sent = Transaction.transferSent(timestamp, amount, destinationAccountNumber);
        TransferTransaction received = Transaction.transferReceived(timestamp, amount, sourceAccountNumber);
        source.apply(sent);
        destination.apply(received);

        log.info("Transferred {} from account {} to account {}", amount, sourceAccountNumber, destinationAccountNumber);
        return WriteResult.of(new TransferRecord(sent, received), store.commit());
    }

    public WriteResult<InterestRun> applyInterest() {
        return applyInterest(defaultInterestRate);
    }

    /**
     * Credits {@code round(balance * rate, 2)} to every account with a positive balance.
     * Accounts whose interest rounds to zero, and accounts at or below zero, are skipped.
     * The files are saved only if at least one account was credited.
     */
    public WriteResult<InterestRun> applyInterest(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationException("rate", "Interest rate must be positive");
        }

        log.info("Applying interest at {}%", rate.movePointRight(2).stripTrailingZeros().toPlainString());

        String timestamp = Timestamps.now(clock);
        int credited = 0;
        Money total = Money.zero();
        for (Account account : store.tables().accounts()) {
            if (!account.getBalance().isPositive()) {
                continue;
            }
            Money interest = account.getBalance().multiply(rate);
            if (!interest.isPositive()) {
                continue;
            }
            account.apply(Transaction.interestApplied(timestamp, interest, rate));
            credited++;
            total = total.add(interest);
        }

        InterestRun run = new InterestRun(credited, total, rate);
        if (credited == 0) {
            log.info("No interest applied; no account had a positive balance large enough to earn interest");
            return WriteResult.of(run, SaveResult.success());
        }

        log.info("Interest applied to {} account(s), total {}", credited, total);
        return WriteResult.of(run, store.commit());
    }

    private Account findAccount(String accountNumber) {
        return store.tables().findAccount(accountNumber)
            .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }

    private static void requirePositive(Money amount, String operation) {
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("amount", operation + " amount must be positive");
        }
    }

    private static void requireFunds(Account account, Money amount) {
        if (amount.isGreaterThan(account.getBalance())) {
            throw new InsufficientFundsException(account.getAccountNumber(), amount, account.getBalance());
        }
    }
}
