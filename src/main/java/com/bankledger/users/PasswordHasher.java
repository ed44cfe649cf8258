package com.bankledger.users;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way password digest: lower-case hex SHA-256 of the UTF-8 bytes.
 */
@Component
public class PasswordHasher {

    private static final String ALGORITHM = "SHA-256";

    public String hash(String password) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(password.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    public boolean matches(String storedHash, String password) {
        if (storedHash == null || password == null) {
            return false;
        }
        return MessageDigest.isEqual(
            storedHash.getBytes(StandardCharsets.US_ASCII),
            hash(password).getBytes(StandardCharsets.US_ASCII));
    }
}
