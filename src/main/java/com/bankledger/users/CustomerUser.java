package com.bankledger.users;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Customer. Owns zero or more accounts, kept in opening order.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CustomerUser extends User {

    private final List<String> ownedAccounts;

    public CustomerUser(String nic, String name, String address, String dateOfBirth, String passwordHash) {
        this(nic, name, address, dateOfBirth, passwordHash, List.of());
    }

    public CustomerUser(String nic, String name, String address, String dateOfBirth, String passwordHash,
                        List<String> ownedAccounts) {
        super(nic, name, address, dateOfBirth, passwordHash);
        this.ownedAccounts = ownedAccounts == null ? new ArrayList<>() : new ArrayList<>(ownedAccounts);
    }

    @Override
    public UserRole getRole() {
        return UserRole.CUSTOMER;
    }

    public List<String> getOwnedAccounts() {
        return Collections.unmodifiableList(ownedAccounts);
    }

    public boolean owns(String accountNumber) {
        return ownedAccounts.contains(accountNumber);
    }

    /**
     * Appends a newly opened account. Only account opening calls this.
     */
    public void addOwnedAccount(String accountNumber) {
        ownedAccounts.add(accountNumber);
    }
}
