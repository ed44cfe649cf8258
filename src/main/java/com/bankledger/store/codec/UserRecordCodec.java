package com.bankledger.store.codec;

import com.bankledger.users.AdminUser;
import com.bankledger.users.CustomerUser;
import com.bankledger.users.User;
import com.bankledger.users.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts users to and from lines of the users file.
 *
 * Line layout, fields joined by {@link RecordDelimiters#FIELD}:
 * {@code nic, name, address, dob, password_hash, role, owned_accounts}.
 * Owned accounts are joined by {@link RecordDelimiters#LIST} and are empty for admins.
 */
@Component
@Slf4j
public class UserRecordCodec {

    static final int FIELD_COUNT = 7;

    public String encode(User user) {
        String ownedAccounts = user instanceof CustomerUser
            ? String.join(RecordDelimiters.LIST, ((CustomerUser) user).getOwnedAccounts())
            : "";

        return String.join(RecordDelimiters.FIELD,
            user.getNic(),
            nullToEmpty(user.getName()),
            nullToEmpty(user.getAddress()),
            nullToEmpty(user.getDateOfBirth()),
            nullToEmpty(user.getPasswordHash()),
            user.getRole().getCode(),
            ownedAccounts);
    }

    /**
     * Parses one line. Returns empty for a malformed line so the caller can skip it.
     */
    public Optional<User> decode(String line) {
        String[] parts = RecordDelimiters.splitFields(line.strip());
        if (parts.length != FIELD_COUNT) {
            log.debug("Malformed user line: expected {} fields, got {}", FIELD_COUNT, parts.length);
            return Optional.empty();
        }

        String nic = parts[0];
        if (nic.isEmpty()) {
            log.debug("Malformed user line: empty NIC");
            return Optional.empty();
        }

        Optional<UserRole> role = UserRole.fromCode(parts[5]);
        if (role.isEmpty()) {
            log.debug("Malformed user line for {}: unknown role '{}'", nic, parts[5]);
            return Optional.empty();
        }

        String ownedAccountsField = parts[6];
        if (role.get() == UserRole.ADMIN) {
            if (!ownedAccountsField.isEmpty()) {
                log.warn("Admin user {} has unexpected owned-accounts data '{}'; ignoring it", nic, ownedAccountsField);
            }
            return Optional.of(new AdminUser(nic, parts[1], parts[2], parts[3], parts[4]));
        }

        return Optional.of(new CustomerUser(nic, parts[1], parts[2], parts[3], parts[4],
            splitOwnedAccounts(ownedAccountsField)));
    }

    private static List<String> splitOwnedAccounts(String field) {
        return Arrays.stream(RecordDelimiters.LIST_PATTERN.split(field, -1))
            .filter(accountNumber -> !accountNumber.isEmpty())
            .collect(Collectors.toList());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
