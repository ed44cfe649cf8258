package com.bankledger.users;

import java.util.Optional;

/**
 * Supplies the details of the first administrator when the ledger starts without users.
 *
 * An interactive front end can implement this by prompting; the default implementation
 * reads configuration.
 */
public interface AdminCredentialsSource {

    /**
     * @return the registration to perform, or empty if no admin can be provided
     */
    Optional<RegistrationRequest> firstAdmin();
}
