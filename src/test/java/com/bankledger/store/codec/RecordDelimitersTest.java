package com.bankledger.store.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecordDelimitersTest {

    @Test
    void testDelimitersShareNoCharacters() {
        for (char c : RecordDelimiters.LIST.toCharArray()) {
            assertEquals(-1, RecordDelimiters.FIELD.indexOf(c));
        }
    }

    @Test
    void testContainsReserved() {
        assertTrue(RecordDelimiters.containsReserved("a|~|b"));
        assertTrue(RecordDelimiters.containsReserved("a;b"));
        assertTrue(RecordDelimiters.containsReserved("line\nbreak"));
        assertTrue(RecordDelimiters.containsReserved("a|b~c"));
        assertTrue(RecordDelimiters.containsReserved("carriage\rreturn"));
        assertFalse(RecordDelimiters.containsReserved("12 Main Street, Colombo"));
        assertFalse(RecordDelimiters.containsReserved(null));
    }

    @Test
    void testEveryDelimiterCharacterIsReserved() {
        for (char c : (RecordDelimiters.FIELD + RecordDelimiters.LIST).toCharArray()) {
            assertTrue(RecordDelimiters.containsReserved("ab" + c), "ab" + c);
            assertTrue(RecordDelimiters.containsReserved(c + "ab"), c + "ab");
        }
        assertEquals("|~;\n\r", RecordDelimiters.RESERVED_CHARACTERS);
    }

    @Test
    void testSplitKeepsTrailingEmptyFields() {
        String[] parts = RecordDelimiters.splitFields("a|~|b|~||~|");
        assertArrayEquals(new String[]{"a", "b", "", ""}, parts);
    }
}
