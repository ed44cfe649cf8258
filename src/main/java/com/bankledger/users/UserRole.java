package com.bankledger.users;

import java.util.Arrays;
import java.util.Optional;

/**
 * Role assigned at registration. Immutable for the life of a user.
 */
public enum UserRole {
    ADMIN("admin"),
    CUSTOMER("customer");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    /**
     * Lower-case code written to the users file.
     */
    public String getCode() {
        return code;
    }

    public static Optional<UserRole> fromCode(String code) {
        return Arrays.stream(values())
            .filter(role -> role.code.equals(code))
            .findFirst();
    }
}
