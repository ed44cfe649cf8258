package com.bankledger.users;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Input for registering a user, as collected by the session layer.
 */
@Value
@Builder(toBuilder = true)
public class RegistrationRequest {
    UserRole role;
    String nic;
    String name;
    String address;
    String dateOfBirth;

    @ToString.Exclude
    String password;

    @ToString.Exclude
    String passwordConfirmation;
}
