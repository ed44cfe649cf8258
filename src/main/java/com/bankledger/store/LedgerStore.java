package com.bankledger.store;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns the in-memory tables shared by the identity and ledger services and writes them
 * through to disk after every mutation.
 *
 * Single writer: callers run one flow of control at a time and no locking is done.
 */
@Component
@Slf4j
public class LedgerStore {

    private final LedgerFileStore fileStore;
    private LedgerTables tables;
    private boolean loaded;

    public LedgerStore(LedgerFileStore fileStore) {
        this.fileStore = fileStore;
        this.tables = fileStore.emptyTables();
    }

    public LedgerTables tables() {
        return tables;
    }

    /**
     * Replaces the working copy with the contents of the data files.
     */
    public LoadReport load() {
        LoadReport report = fileStore.load();
        this.tables = report.getTables();
        this.loaded = true;
        return report;
    }

    /**
     * Discards all users, accounts and the counter. Used before creating the first admin.
     */
    public void reset() {
        this.tables = fileStore.emptyTables();
        this.loaded = true;
    }

    /**
     * Writes the whole working copy to disk. In-memory state is kept regardless of the outcome.
     */
    public SaveResult commit() {
        SaveResult result = fileStore.save(tables);
        if (!result.isSuccessful()) {
            log.error("Save incomplete, durability at risk: {} file(s) not written: {}",
                result.getFailures().size(), result.getFailures());
        }
        return result;
    }

    @PreDestroy
    void saveOnShutdown() {
        if (!loaded) {
            return;
        }
        log.info("Saving ledger before shutdown");
        commit();
    }
}
