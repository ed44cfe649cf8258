package com.bankledger.users;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base type for registered users.
 *
 * A user is keyed by its NIC (national identity number), which is also the login name.
 * Only customers own accounts; see {@link CustomerUser}.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class User {

    private final String nic;
    private final String name;
    private final String address;
    private final String dateOfBirth;

    @ToString.Exclude
    private final String passwordHash;

    protected User(String nic, String name, String address, String dateOfBirth, String passwordHash) {
        this.nic = nic;
        this.name = name;
        this.address = address;
        this.dateOfBirth = dateOfBirth;
        this.passwordHash = passwordHash;
    }

    public abstract UserRole getRole();

    public boolean isAdmin() {
        return getRole() == UserRole.ADMIN;
    }
}
