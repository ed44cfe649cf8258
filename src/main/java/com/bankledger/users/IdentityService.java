package com.bankledger.users;

import com.bankledger.common.exception.AuthenticationFailedException;
import com.bankledger.common.exception.DuplicateUserException;
import com.bankledger.common.exception.UserNotFoundException;
import com.bankledger.common.exception.ValidationException;
import com.bankledger.store.LedgerStore;
import com.bankledger.store.WriteResult;
import com.bankledger.store.codec.RecordDelimiters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Registers users and verifies their credentials.
 *
 * Registration validates every field before touching the tables, so a rejected request
 * leaves no trace. Passwords are kept only as a SHA-256 digest.
 */
@Service
@Slf4j
public class IdentityService {

    private static final Pattern DATE_OF_BIRTH = Pattern.compile("^[0-9]{4}-[0-9]{2}-[0-9]{2}$");

    private final LedgerStore store;
    private final PasswordHasher passwordHasher;
    private final int minPasswordLength;
    private final int maxLoginAttempts;

    public IdentityService(
            LedgerStore store,
            PasswordHasher passwordHasher,
            @Value("${bank-ledger.security.min-password-length:6}") int minPasswordLength,
            @Value("${bank-ledger.security.max-login-attempts:3}") int maxLoginAttempts) {
        this.store = store;
        this.passwordHasher = passwordHasher;
        this.minPasswordLength = minPasswordLength;
        this.maxLoginAttempts = maxLoginAttempts;
    }

    public WriteResult<User> registerCustomer(RegistrationRequest request) {
        return register(request.toBuilder().role(UserRole.CUSTOMER).build());
    }

    public WriteResult<User> registerAdmin(RegistrationRequest request) {
        return register(request.toBuilder().role(UserRole.ADMIN).build());
    }

    /**
     * Validates and stores a new user, then saves.
     *
     * @throws ValidationException if a field is empty, malformed or holds a reserved delimiter
     * @throws DuplicateUserException if the NIC is already registered
     */
    public WriteResult<User> register(RegistrationRequest request) {
        if (request.getRole() == null) {
            throw new ValidationException("role", "Role is required");
        }

        String nic = trim(request.getNic());
        if (nic.isEmpty()) {
            throw new ValidationException("nic", "NIC cannot be empty");
        }
        if (store.tables().containsUser(nic)) {
            throw new DuplicateUserException(nic);
        }
        requireNoReserved("nic", "NIC", nic);

        String name = toTitleCase(trim(request.getName()));
        requireNoReserved("name", "Name", name);
        if (name.isEmpty()) {
            log.warn("Registering {} with a blank name", nic);
        }

        String address = trim(request.getAddress());
        requireNoReserved("address", "Address", address);
        if (address.isEmpty()) {
            log.warn("Registering {} with a blank address", nic);
        }

        String dateOfBirth = trim(request.getDateOfBirth());
        if (!DATE_OF_BIRTH.matcher(dateOfBirth).matches()) {
            throw new ValidationException("dateOfBirth", "Invalid date format. Use YYYY-MM-DD (e.g., 1990-05-15)");
        }

        validatePassword(request.getPassword(), request.getPasswordConfirmation());
        String passwordHash = passwordHasher.hash(request.getPassword());

        User user = request.getRole() == UserRole.ADMIN
            ? new AdminUser(nic, name, address, dateOfBirth, passwordHash)
            : new CustomerUser(nic, name, address, dateOfBirth, passwordHash);

        store.tables().putUser(user);
        log.info("Registered {} user {}", user.getRole().getCode(), nic);

        return WriteResult.of(user, store.commit());
    }

    /**
     * Checks passwords drawn from {@code passwordPrompt} until one matches or the attempt
     * limit is reached. A {@code null} from the prompt counts as a wrong attempt.
     *
     * @throws UserNotFoundException if no user has this NIC; no attempts are consumed
     * @throws AuthenticationFailedException if every attempt was wrong
     */
    public User authenticate(String nic, Supplier<String> passwordPrompt) {
        String key = trim(nic);
        User user = store.tables().findUser(key)
            .orElseThrow(() -> new UserNotFoundException(key));

        for (int attempt = 1; attempt <= maxLoginAttempts; attempt++) {
            if (passwordHasher.matches(user.getPasswordHash(), passwordPrompt.get())) {
                log.info("User {} ({}) logged in", key, user.getRole().getCode());
                return user;
            }
            log.warn("Incorrect password for {}. {} attempts remaining", key, maxLoginAttempts - attempt);
        }

        throw new AuthenticationFailedException(key, maxLoginAttempts);
    }

    /**
     * Convenience overload taking the attempts up front.
     */
    public User authenticate(String nic, List<String> passwordAttempts) {
        Iterator<String> attempts = passwordAttempts.iterator();
        return authenticate(nic, () -> attempts.hasNext() ? attempts.next() : null);
    }

    public Optional<User> findUser(String nic) {
        return store.tables().findUser(nic);
    }

    public User getUser(String nic) {
        return findUser(nic).orElseThrow(() -> new UserNotFoundException(nic));
    }

    private void validatePassword(String password, String confirmation) {
        if (password == null || password.isEmpty()) {
            throw new ValidationException("password", "Password cannot be empty");
        }
        if (password.length() < minPasswordLength) {
            throw new ValidationException("password",
                "Password must be at least " + minPasswordLength + " characters");
        }
        if (!password.equals(confirmation)) {
            throw new ValidationException("passwordConfirmation", "Passwords do not match");
        }
    }

    private static void requireNoReserved(String field, String label, String value) {
        if (RecordDelimiters.containsReserved(value)) {
            throw new ValidationException(field, String.format(
                "%s cannot contain any of the characters '%s' or line breaks",
                label, RecordDelimiters.RESERVED_CHARACTERS.strip()));
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest,
     * e.g. {@code "jane o'neil"} becomes {@code "Jane O'Neil"}.
     */
    static String toTitleCase(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            previousIsLetter = Character.isLetter(c);
        }
        return result.toString();
    }
}
