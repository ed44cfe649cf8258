package com.bankledger.users;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * First-admin details taken from {@code bank-ledger.bootstrap.admin.*}.
 */
@Component
public class ConfiguredAdminCredentials implements AdminCredentialsSource {

    @Value("${bank-ledger.bootstrap.admin.nic:admin}")
    private String nic;

    @Value("${bank-ledger.bootstrap.admin.name:Administrator}")
    private String name;

    @Value("${bank-ledger.bootstrap.admin.address:Head Office}")
    private String address;

    @Value("${bank-ledger.bootstrap.admin.date-of-birth:1970-01-01}")
    private String dateOfBirth;

    @Value("${bank-ledger.bootstrap.admin.password:}")
    private String password;

    @Override
    public Optional<RegistrationRequest> firstAdmin() {
        if (nic == null || nic.isBlank() || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RegistrationRequest.builder()
            .role(UserRole.ADMIN)
            .nic(nic)
            .name(name)
            .address(address)
            .dateOfBirth(dateOfBirth)
            .password(password)
            .passwordConfirmation(password)
            .build());
    }
}
