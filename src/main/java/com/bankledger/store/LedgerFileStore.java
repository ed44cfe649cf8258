package com.bankledger.store;

import com.bankledger.accounts.Account;
import com.bankledger.store.codec.AccountRecordCodec;
import com.bankledger.store.codec.UserRecordCodec;
import com.bankledger.users.CustomerUser;
import com.bankledger.users.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reads and writes the three flat data files: users, accounts and the account-number counter.
 *
 * Saves replace each file whole. Loads decode line by line and skip malformed or
 * non-UTF-8 lines with a warning; a missing, empty or unreadable file yields an empty table.
 */
@Component
@Slf4j
public class LedgerFileStore {

    private final Path usersFile;
    private final Path accountsFile;
    private final Path counterFile;
    private final long firstAccountNumber;
    private final UserRecordCodec userCodec;
    private final AccountRecordCodec accountCodec;

    public LedgerFileStore(
            @Value("${bank-ledger.storage.directory:data}") String directory,
            @Value("${bank-ledger.storage.users-file:users.txt}") String usersFile,
            @Value("${bank-ledger.storage.accounts-file:accounts.txt}") String accountsFile,
            @Value("${bank-ledger.storage.counter-file:next_account_number.txt}") String counterFile,
            @Value("${bank-ledger.accounts.first-account-number:1001}") long firstAccountNumber,
            UserRecordCodec userCodec,
            AccountRecordCodec accountCodec) {

        Path dataDirectory = Path.of(directory);
        this.usersFile = dataDirectory.resolve(usersFile);
        this.accountsFile = dataDirectory.resolve(accountsFile);
        this.counterFile = dataDirectory.resolve(counterFile);
        this.firstAccountNumber = firstAccountNumber;
        this.userCodec = userCodec;
        this.accountCodec = accountCodec;

        log.info("Ledger file store initialized: directory={}", dataDirectory.toAbsolutePath());
    }

    /**
     * Fresh tables with the counter at its configured starting value.
     */
    public LedgerTables emptyTables() {
        return new LedgerTables(firstAccountNumber);
    }

    public LoadReport load() {
        LoadReport.LoadReportBuilder report = LoadReport.builder();
        boolean fileIssues = false;

        List<User> users = new ArrayList<>();
        LineStats userStats = readLines(usersFile, "user", userCodec::decode, users::add, report);
        fileIssues |= userStats.fileIssue;

        List<Account> accounts = new ArrayList<>();
        LineStats accountStats = readLines(accountsFile, "account", accountCodec::decode, accounts::add, report);
        fileIssues |= accountStats.fileIssue;

        CounterRead counter = readCounter(report);
        fileIssues |= counter.fileIssue;

        LedgerTables tables = new LedgerTables(counter.value);
        users.forEach(tables::putUser);
        accounts.forEach(tables::putAccount);

        boolean adminMissing = !tables.users().isEmpty() && !tables.hasAdmin();
        if (adminMissing) {
            warn(report, "Loaded user data, but no admin user found; some operations will be unavailable");
        }
        checkReferences(tables, report);

        log.info("Loaded {} users, {} accounts, next account number {}",
            tables.users().size(), tables.accounts().size(), tables.getNextAccountNumber());

        return report
            .tables(tables)
            .skippedUserLines(userStats.skipped)
            .skippedAccountLines(accountStats.skipped)
            .fileIssues(fileIssues)
            .adminMissing(adminMissing)
            .build();
    }

    /**
     * Writes all three files. A failure on one file is recorded and the remaining files
     * are still attempted.
     */
    public SaveResult save(LedgerTables tables) {
        List<SaveResult.Failure> failures = new ArrayList<>();

        writeLines(usersFile, tables.users().stream().map(userCodec::encode).toList(), failures);
        writeLines(accountsFile, tables.accounts().stream().map(accountCodec::encode).toList(), failures);
        writeLines(counterFile, List.of(String.valueOf(tables.getNextAccountNumber())), failures);

        if (failures.isEmpty()) {
            log.debug("Saved {} users and {} accounts", tables.users().size(), tables.accounts().size());
        }
        return SaveResult.of(failures);
    }

    private <T> LineStats readLines(Path file, String kind, Function<String, Optional<T>> decoder,
                                    Consumer<T> sink, LoadReport.LoadReportBuilder report) {
        LineStats stats = new LineStats();
        if (!Files.exists(file)) {
            warn(report, String.format("Data file %s not found", file.getFileName()));
            stats.fileIssue = true;
            return stats;
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Could not read {}", file, e);
            warn(report, String.format("Could not read %s: %s", file.getFileName(), e.getMessage()));
            stats.fileIssue = true;
            return stats;
        }

        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        int lineNumber = 0;
        int decoded = 0;
        int start = 0;
        while (start < content.length) {
            int end = start;
            while (end < content.length && content[end] != '\n') {
                end++;
            }
            lineNumber++;
            int length = end - start;
            if (length > 0 && content[end - 1] == '\r') {
                length--;
            }
            ByteBuffer bytes = ByteBuffer.wrap(content, start, length);
            start = end + 1;

            String line;
            try {
                line = utf8.decode(bytes).toString();
            } catch (CharacterCodingException e) {
                stats.skipped++;
                warn(report, String.format("Skipping undecodable %s data on line %d in %s (not UTF-8)",
                    kind, lineNumber, file.getFileName()));
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            Optional<T> record = decoder.apply(line);
            if (record.isPresent()) {
                sink.accept(record.get());
                decoded++;
            } else {
                stats.skipped++;
                warn(report, String.format("Skipping malformed %s data on line %d in %s",
                    kind, lineNumber, file.getFileName()));
            }
        }
        if (decoded == 0 && stats.skipped == 0) {
            warn(report, String.format("Data file %s is empty", file.getFileName()));
            stats.fileIssue = true;
        }
        return stats;
    }

    private CounterRead readCounter(LoadReport.LoadReportBuilder report) {
        if (!Files.exists(counterFile)) {
            warn(report, String.format("Counter file %s not found; using default %d",
                counterFile.getFileName(), firstAccountNumber));
            return new CounterRead(firstAccountNumber, true);
        }
        try {
            String content = Files.readString(counterFile, StandardCharsets.UTF_8).strip();
            if (content.isEmpty() || !content.chars().allMatch(Character::isDigit) || content.length() > 18) {
                warn(report, String.format("Invalid content in %s ('%s'); using default %d",
                    counterFile.getFileName(), content, firstAccountNumber));
                return new CounterRead(firstAccountNumber, true);
            }
            return new CounterRead(Long.parseLong(content), false);
        } catch (IOException e) {
            log.warn("Could not read {}", counterFile, e);
            warn(report, String.format("Could not read %s; using default %d",
                counterFile.getFileName(), firstAccountNumber));
            return new CounterRead(firstAccountNumber, true);
        }
    }

    /**
     * Writes to a sibling temporary file, then moves it over the target so a reader never
     * sees a half-written table.
     */
    private void writeLines(Path file, List<String> lines, List<SaveResult.Failure> failures) {
        Path temporary = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
                for (String line : lines) {
                    writer.write(line);
                    writer.newLine();
                }
            }
            replace(temporary, file);
        } catch (IOException e) {
            log.error("Could not save {}; changes might be lost", file, e);
            failures.add(new SaveResult.Failure(file.getFileName().toString(), e.getMessage()));
            discard(temporary);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}; replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temporary, e);
        }
    }

    /**
     * Owned-account lists and account owners should point at each other. Mismatches are
     * reported but left in place.
     */
    private void checkReferences(LedgerTables tables, LoadReport.LoadReportBuilder report) {
        for (User user : tables.users()) {
            if (!(user instanceof CustomerUser)) {
                continue;
            }
            for (String accountNumber : ((CustomerUser) user).getOwnedAccounts()) {
                Optional<Account> account = tables.findAccount(accountNumber);
                if (account.isEmpty()) {
                    warn(report, String.format("User %s lists account %s, which does not exist",
                        user.getNic(), accountNumber));
                } else if (!account.get().isOwnedBy(user.getNic())) {
                    warn(report, String.format("User %s lists account %s, which is owned by %s",
                        user.getNic(), accountNumber, account.get().getOwnerNic()));
                }
            }
        }
        for (Account account : tables.accounts()) {
            if (!tables.containsUser(account.getOwnerNic())) {
                warn(report, String.format("Account %s belongs to unknown user %s",
                    account.getAccountNumber(), account.getOwnerNic()));
            }
        }
    }

    private static void warn(LoadReport.LoadReportBuilder report, String message) {
        log.warn(message);
        report.warning(message);
    }

    private static class LineStats {
        private int skipped;
        private boolean fileIssue;
    }

    private static class CounterRead {
        private final long value;
        private final boolean fileIssue;

        private CounterRead(long value, boolean fileIssue) {
            this.value = value;
            this.fileIssue = fileIssue;
        }
    }
}
