package com.bankledger.store;

import com.bankledger.common.exception.PersistenceException;
import com.bankledger.users.AdminCredentialsSource;
import com.bankledger.users.IdentityService;
import com.bankledger.users.RegistrationRequest;
import com.bankledger.users.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the ledger at startup and, when no users survive the load, starts over with a
 * single administrator.
 *
 * Bootstrap flow:
 * 1. Load all three files into the store
 * 2. If the users table is empty, reset every table and the counter
 * 3. Register the first admin through the normal registration path
 * 4. Save, so the data files exist from then on
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerBootstrapper implements ApplicationRunner {

    private final LedgerStore store;
    private final IdentityService identityService;
    private final AdminCredentialsSource adminCredentials;

    @Override
    public void run(ApplicationArguments args) {
        start();
    }

    /**
     * @throws PersistenceException if a fresh start is needed but no admin can be created or saved
     */
    public LoadReport start() {
        LoadReport report = store.load();
        if (!store.tables().users().isEmpty()) {
            log.info("Data loading complete");
            return report;
        }

        if (report.isFileIssues()) {
            log.warn("Some data files were missing or unreadable. This may be the first run or data is incomplete");
        } else {
            log.warn("Data files found, but no valid user data loaded");
        }

        log.info("Initializing fresh start: resetting data stores");
        store.reset();

        RegistrationRequest request = adminCredentials.firstAdmin()
            .orElseThrow(() -> new PersistenceException(
                "No administrator credentials available; cannot initialize an empty ledger"));
        WriteResult<User> admin = identityService.registerAdmin(request);
        if (!admin.isDurable()) {
            throw new PersistenceException("Initial admin created but data files could not be written: "
                + admin.getSaveResult().getFailures());
        }

        log.info("Initial admin user {} created and all data files initialized", admin.getValue().getNic());
        return report.toBuilder()
            .tables(store.tables())
            .bootstrapped(true)
            .build();
    }
}
