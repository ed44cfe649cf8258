package com.bankledger.store;

import com.bankledger.accounts.Account;
import com.bankledger.users.User;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory working copy of the ledger: users by NIC, accounts by number, and the
 * next account number to hand out. Iteration follows insertion order.
 */
public class LedgerTables {

    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private long nextAccountNumber;

    public LedgerTables(long nextAccountNumber) {
        this.nextAccountNumber = nextAccountNumber;
    }

    public Optional<User> findUser(String nic) {
        return Optional.ofNullable(users.get(nic));
    }

    public boolean containsUser(String nic) {
        return users.containsKey(nic);
    }

    public void putUser(User user) {
        users.put(user.getNic(), user);
    }

    public Collection<User> users() {
        return Collections.unmodifiableCollection(users.values());
    }

    public Optional<Account> findAccount(String accountNumber) {
        return Optional.ofNullable(accounts.get(accountNumber));
    }

    public boolean containsAccount(String accountNumber) {
        return accounts.containsKey(accountNumber);
    }

    public void putAccount(Account account) {
        accounts.put(account.getAccountNumber(), account);
    }

    public Collection<Account> accounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public long getNextAccountNumber() {
        return nextAccountNumber;
    }

    /**
     * Hands out the next account number, skipping numbers already used by an account.
     * A stale counter therefore never produces a duplicate.
     */
    public String allocateAccountNumber() {
        while (accounts.containsKey(String.valueOf(nextAccountNumber))) {
            nextAccountNumber++;
        }
        String accountNumber = String.valueOf(nextAccountNumber);
        nextAccountNumber++;
        return accountNumber;
    }

    public boolean hasAdmin() {
        return users.values().stream().anyMatch(User::isAdmin);
    }
}
