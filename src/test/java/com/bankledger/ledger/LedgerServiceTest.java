package com.bankledger.ledger;

import com.bankledger.accounts.Account;
import com.bankledger.accounts.AccountService;
import com.bankledger.common.Money;
import com.bankledger.common.exception.AccountNotFoundException;
import com.bankledger.common.exception.InsufficientFundsException;
import com.bankledger.common.exception.ValidationException;
import com.bankledger.store.LedgerFileStore;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.LedgerTables;
import com.bankledger.store.SaveResult;
import com.bankledger.store.WriteResult;
import com.bankledger.users.CustomerUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for balance-changing operations.
 *
 * Covers:
 * - Rejected operations leave balances, logs and files untouched
 * - Transfers move the same amount out of one account and into the other
 * - Every balance equals the signed sum of its log
 */
@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
    private static final BigDecimal RATE = new BigDecimal("0.015");

    @Mock
    private LedgerFileStore fileStore;

    private LedgerStore store;
    private AccountService accountService;
    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        when(fileStore.emptyTables()).thenReturn(new LedgerTables(1001));
        lenient().when(fileStore.save(any())).thenReturn(SaveResult.success());

        store = new LedgerStore(fileStore);
        accountService = new AccountService(store, CLOCK, BigDecimal.ZERO);
        ledgerService = new LedgerService(store, CLOCK, RATE);

        store.tables().putUser(new CustomerUser("X", "Customer X", "1 Road", "1990-01-01", "hash"));
        store.tables().putUser(new CustomerUser("Y", "Customer Y", "2 Road", "1991-01-01", "hash"));
    }

    @Test
    void testDeposit() {
        Account account = open("X", "10.00");

        WriteResult<Transaction> result = ledgerService.deposit(account.getAccountNumber(), Money.of("25.50"));

        assertTrue(result.isDurable());
        assertEquals(TransactionType.DEPOSIT, result.getValue().getType());
        assertEquals("2024-05-01 10:15:30", result.getValue().getTimestamp());
        assertEquals(Money.of("35.50"), account.getBalance());
        assertEquals(2, account.getTransactions().size());
    }

    @Test
    void testDepositRejectsNonPositiveAmount() {
        Account account = open("X", "10.00");
        clearInvocations(fileStore);

        assertThrows(ValidationException.class, () -> ledgerService.deposit(account.getAccountNumber(), Money.zero()));
        assertThrows(ValidationException.class,
            () -> ledgerService.deposit(account.getAccountNumber(), Money.of("-5.00")));

        assertEquals(Money.of("10.00"), account.getBalance());
        assertEquals(1, account.getTransactions().size());
        verify(fileStore, never()).save(any());
    }

    @Test
    void testDepositUnknownAccount() {
        assertThrows(AccountNotFoundException.class, () -> ledgerService.deposit("9999", Money.of("1.00")));
    }

    @Test
    void testWithdraw() {
        Account account = open("X", "100.00");

        WriteResult<Transaction> result = ledgerService.withdraw(account.getAccountNumber(), Money.of("30.00"));

        assertEquals(TransactionType.WITHDRAWAL, result.getValue().getType());
        assertEquals(Money.of("70.00"), account.getBalance());
    }

    @Test
    void testWithdrawEntireBalance() {
        Account account = open("X", "100.00");

        ledgerService.withdraw(account.getAccountNumber(), Money.of("100.00"));

        assertEquals(Money.zero(), account.getBalance());
    }

    @Test
    void testWithdrawMoreThanBalanceRejected() {
        Account account = open("X", "100.00");
        clearInvocations(fileStore);

        InsufficientFundsException error = assertThrows(InsufficientFundsException.class,
            () -> ledgerService.withdraw(account.getAccountNumber(), Money.of("100.01")));

        assertEquals(Money.of("100.01"), error.getRequested());
        assertEquals(Money.of("100.00"), error.getAvailable());
        assertEquals(Money.of("100.00"), account.getBalance());
        assertEquals(1, account.getTransactions().size());
        verify(fileStore, never()).save(any());
    }

    @Test
    void testWithdrawFromEmptyAccountRejected() {
        Account account = open("X", "0.00");

        assertThrows(InsufficientFundsException.class,
            () -> ledgerService.withdraw(account.getAccountNumber(), Money.of("1.00")));
        assertTrue(account.getTransactions().isEmpty());
    }

    @Test
    void testTransfer() {
        Account source = open("X", "100.00");
        Account destination = open("Y", "5.00");

        WriteResult<TransferRecord> result =
            ledgerService.transfer(source.getAccountNumber(), destination.getAccountNumber(), Money.of("40.00"));

        assertEquals(Money.of("60.00"), source.getBalance());
        assertEquals(Money.of("45.00"), destination.getBalance());
        assertEquals(2, source.getTransactions().size());
        assertEquals(2, destination.getTransactions().size());

        TransferTransaction sent = result.getValue().getSent();
        TransferTransaction received = result.getValue().getReceived();
        assertEquals(TransactionType.TRANSFER_SENT, sent.getType());
        assertEquals(destination.getAccountNumber(), sent.getCounterpartyAccount());
        assertEquals(TransactionType.TRANSFER_RECEIVED, received.getType());
        assertEquals(source.getAccountNumber(), received.getCounterpartyAccount());
        assertSame(sent, source.getTransactions().get(1));
        assertSame(received, destination.getTransactions().get(1));
        assertEquals(Money.of("40.00"), sent.getAmount());
        assertEquals(Money.of("40.00"), received.getAmount());
    }

    @Test
    void testTransferToSameAccountRejected() {
        Account account = open("X", "100.00");

        assertThrows(ValidationException.class,
            () -> ledgerService.transfer(account.getAccountNumber(), account.getAccountNumber(), Money.of("1.00")));
        assertEquals(Money.of("100.00"), account.getBalance());
    }

    @Test
    void testTransferToUnknownAccountRejected() {
        Account account = open("X", "100.00");
        clearInvocations(fileStore);

        assertThrows(AccountNotFoundException.class,
            () -> ledgerService.transfer(account.getAccountNumber(), "9999", Money.of("1.00")));
        assertThrows(ValidationException.class,
            () -> ledgerService.transfer(account.getAccountNumber(), " ", Money.of("1.00")));

        assertEquals(Money.of("100.00"), account.getBalance());
        assertEquals(1, account.getTransactions().size());
        verify(fileStore, never()).save(any());
    }

    @Test
    void testTransferWithInsufficientFundsChangesNeitherSide() {
        Account source = open("X", "10.00");
        Account destination = open("Y", "5.00");

        assertThrows(InsufficientFundsException.class,
            () -> ledgerService.transfer(source.getAccountNumber(), destination.getAccountNumber(), Money.of("10.01")));

        assertEquals(Money.of("10.00"), source.getBalance());
        assertEquals(Money.of("5.00"), destination.getBalance());
        assertEquals(1, source.getTransactions().size());
        assertEquals(1, destination.getTransactions().size());
    }

    @Test
    void testInterestOnlyForPositiveBalances() {
        store.tables().putAccount(new Account("2001", "X", Money.zero(), "2024-01-01 00:00:00", List.of()));
        store.tables().putAccount(new Account("2002", "X", Money.of("-5.00"), "2024-01-01 00:00:00", List.of()));
        store.tables().putAccount(new Account("2003", "Y", Money.of("1000.00"), "2024-01-01 00:00:00", List.of()));

        WriteResult<InterestRun> result = ledgerService.applyInterest(RATE);

        assertEquals(1, result.getValue().getAccountsCredited());
        assertEquals(Money.of("15.00"), result.getValue().getTotalInterest());
        assertEquals(Money.zero(), store.tables().findAccount("2001").orElseThrow().getBalance());
        assertEquals(Money.of("-5.00"), store.tables().findAccount("2002").orElseThrow().getBalance());
        assertTrue(store.tables().findAccount("2001").orElseThrow().getTransactions().isEmpty());
        assertTrue(store.tables().findAccount("2002").orElseThrow().getTransactions().isEmpty());

        Account credited = store.tables().findAccount("2003").orElseThrow();
        assertEquals(Money.of("1015.00"), credited.getBalance());
        assertEquals(1, credited.getTransactions().size());
        InterestTransaction interest = (InterestTransaction) credited.getTransactions().get(0);
        assertEquals(Money.of("15.00"), interest.getAmount());
        assertEquals(RATE, interest.getRate());
        verify(fileStore).save(any());
    }

    @Test
    void testInterestThatRoundsToZeroIsSkipped() {
        Account tiny = open("X", "0.30");
        clearInvocations(fileStore);

        WriteResult<InterestRun> result = ledgerService.applyInterest();

        assertEquals(0, result.getValue().getAccountsCredited());
        assertEquals(Money.zero(), result.getValue().getTotalInterest());
        assertEquals(Money.of("0.30"), tiny.getBalance());
        verify(fileStore, never()).save(any());
    }

    @Test
    void testInterestUsesConfiguredRateByDefault() {
        open("X", "200.00");
        open("Y", "333.33");

        InterestRun run = ledgerService.applyInterest().getValue();

        assertEquals(RATE, run.getRate());
        assertEquals(2, run.getAccountsCredited());
        assertEquals(Money.of("8.00"), run.getTotalInterest());
    }

    @Test
    void testBalanceEqualsSignedSumOfTransactions() {
        Account a = open("X", "500.00");
        Account b = open("Y", "0.00");

        ledgerService.deposit(a.getAccountNumber(), Money.of("120.25"));
        ledgerService.withdraw(a.getAccountNumber(), Money.of("20.25"));
        ledgerService.transfer(a.getAccountNumber(), b.getAccountNumber(), Money.of("300.00"));
        ledgerService.applyInterest(RATE);
        ledgerService.transfer(b.getAccountNumber(), a.getAccountNumber(), Money.of("4.50"));
        ledgerService.withdraw(b.getAccountNumber(), Money.of("0.50"));
        assertThrows(InsufficientFundsException.class,
            () -> ledgerService.withdraw(b.getAccountNumber(), Money.of("1000.00")));

        for (Account account : List.of(a, b)) {
            Money sum = account.getTransactions().stream()
                .map(Transaction::getSignedAmount)
                .reduce(Money.zero(), Money::add);
            assertEquals(account.getBalance(), sum, account.getAccountNumber());
        }
        assertEquals(Money.of("309.00"), a.getBalance());
        assertEquals(Money.of("299.50"), b.getBalance());
    }

    @Test
    void testOpenWithdrawThenOverdrawnTransfer() {
        Account account = open("X", "100.00");
        Account other = open("Y", "0.00");
        assertEquals(1, account.getTransactions().size());
        assertEquals(TransactionType.INITIAL_DEPOSIT, account.getTransactions().get(0).getType());

        ledgerService.withdraw(account.getAccountNumber(), Money.of("30.00"));
        assertEquals(Money.of("70.00"), account.getBalance());

        assertThrows(InsufficientFundsException.class,
            () -> ledgerService.transfer(other.getAccountNumber(), account.getAccountNumber(), Money.of("50.00")));
        assertEquals(Money.of("70.00"), account.getBalance());
        assertEquals(Money.zero(), other.getBalance());
        assertEquals(2, account.getTransactions().size());
        assertTrue(other.getTransactions().isEmpty());
    }

    private Account open(String nic, String initialDeposit) {
        return accountService.openAccount(nic, Money.of(initialDeposit)).getValue();
    }
}
