package com.bankledger.users;

/**
 * Administrator. Can list users and accounts and run interest accrual; owns no accounts.
 */
public class AdminUser extends User {

    public AdminUser(String nic, String name, String address, String dateOfBirth, String passwordHash) {
        super(nic, name, address, dateOfBirth, passwordHash);
    }

    @Override
    public UserRole getRole() {
        return UserRole.ADMIN;
    }
}
