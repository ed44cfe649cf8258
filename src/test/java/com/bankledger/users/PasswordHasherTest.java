package com.bankledger.users;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher();

    @Test
    void testSha256Hex() {
        assertEquals("5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8", hasher.hash("password"));
    }

    @Test
    void testMatches() {
        String hash = hasher.hash("s3cret-pass");

        assertTrue(hasher.matches(hash, "s3cret-pass"));
        assertFalse(hasher.matches(hash, "S3cret-pass"));
        assertFalse(hasher.matches(hash, null));
        assertFalse(hasher.matches(null, "s3cret-pass"));
    }
}
