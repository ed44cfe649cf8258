package com.bankledger.reporting;

import com.bankledger.accounts.Account;
import com.bankledger.common.Money;
import com.bankledger.common.exception.AccountNotFoundException;
import com.bankledger.ledger.Transaction;
import com.bankledger.store.LedgerFileStore;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.LedgerTables;
import com.bankledger.users.AdminUser;
import com.bankledger.users.CustomerUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportingServiceTest {

    private static final String TS = "2024-05-01 10:15:30";

    @Mock
    private LedgerFileStore fileStore;

    private LedgerStore store;
    private ReportingService reportingService;

    @BeforeEach
    void setUp() {
        when(fileStore.emptyTables()).thenReturn(new LedgerTables(1003));
        store = new LedgerStore(fileStore);
        reportingService = new ReportingService(store);

        LedgerTables tables = store.tables();
        tables.putUser(new AdminUser("admin", "Administrator", "HQ", "1970-01-01", "hash"));
        tables.putUser(new CustomerUser("C1", "Jane Doe", "12 Main St", "1990-05-15", "hash", List.of("1001")));
        tables.putUser(new CustomerUser("C2", "John Roe", "14 Main St", "1985-01-20", "hash"));
        tables.putAccount(new Account("1001", "C1", Money.of("1234.50"), TS, List.of(
            Transaction.initialDeposit(TS, Money.of("1000.00")),
            Transaction.transferReceived(TS, Money.of("300.00"), "1002"),
            Transaction.transferSent(TS, Money.of("80.00"), "1002"),
            Transaction.interestApplied(TS, Money.of("14.50"), new BigDecimal("0.015")))));
        tables.putAccount(new Account("1002", "GONE", Money.zero(), TS, List.of()));
    }

    @Test
    void testListUsers() {
        List<UserSummary> users = reportingService.listUsers();

        assertEquals(3, users.size());
        assertEquals("N/A", users.get(0).getOwnedAccountsDisplay());
        assertEquals("1001", users.get(1).getOwnedAccountsDisplay());
        assertEquals("None", users.get(2).getOwnedAccountsDisplay());
    }

    @Test
    void testListAccountsWithUnknownOwner() {
        List<AccountSummary> accounts = reportingService.listAccounts();

        assertEquals("Jane Doe", accounts.get(0).getOwnerName());
        assertEquals("$1,234.50", accounts.get(0).getBalance().format());
        assertEquals("N/A", accounts.get(1).getOwnerName());
    }

    @Test
    void testCustomerDirectorySkipsAdmins() {
        assertEquals(List.of("C1: Jane Doe", "C2: John Roe"), reportingService.customerDirectory());
    }

    @Test
    void testTransactionHistoryDetails() {
        List<TransactionView> history = reportingService.transactionHistory("1001");

        assertEquals(4, history.size());
        assertEquals("Initial Deposit", history.get(0).getType());
        assertEquals("N/A", history.get(0).getDetails());
        assertEquals("From Acct: 1002", history.get(1).getDetails());
        assertEquals("To Acct: 1002", history.get(2).getDetails());
        assertEquals("Interest Applied", history.get(3).getType());
        assertEquals("Rate: 1.50% p.a.", history.get(3).getDetails());
    }

    @Test
    void testBalance() {
        assertEquals(Money.of("1234.50"), reportingService.balance("1001"));
        assertEquals("$0.00", reportingService.balance("1002").format());
    }

    @Test
    void testUnknownAccount() {
        assertThrows(AccountNotFoundException.class, () -> reportingService.transactionHistory("9999"));
        assertThrows(AccountNotFoundException.class, () -> reportingService.balance("9999"));
    }
}
