package com.bankledger.store.codec;

import java.util.regex.Pattern;

/**
 * Reserved separators of the flat data files.
 *
 * The field delimiter separates the columns of a record; the list delimiter separates the
 * entries of a customer's owned-accounts column. The two share no characters, and no
 * character of either may appear inside a stored value: a value ending in part of the field
 * delimiter would otherwise merge with the delimiter that follows it.
 */
public final class RecordDelimiters {

    public static final String FIELD = "|~|";
    public static final String LIST = ";";

    /**
     * Every character that may not appear in a stored value.
     */
    public static final String RESERVED_CHARACTERS = distinctCharacters(FIELD + LIST) + "\n\r";

    static final Pattern FIELD_PATTERN = Pattern.compile(Pattern.quote(FIELD));
    static final Pattern LIST_PATTERN = Pattern.compile(Pattern.quote(LIST));

    static {
        for (char c : LIST.toCharArray()) {
            if (FIELD.indexOf(c) >= 0) {
                throw new ExceptionInInitializerError("Field and list delimiters overlap on '" + c + "'");
            }
        }
    }

    private RecordDelimiters() {
    }

    /**
     * True if the value would break a record: it holds a delimiter character or a line break.
     */
    public static boolean containsReserved(String value) {
        if (value == null) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (RESERVED_CHARACTERS.indexOf(value.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String distinctCharacters(String value) {
        StringBuilder distinct = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (distinct.indexOf(String.valueOf(c)) < 0) {
                distinct.append(c);
            }
        }
        return distinct.toString();
    }

    /**
     * Splits on the field delimiter, keeping trailing empty fields.
     */
    static String[] splitFields(String line) {
        return FIELD_PATTERN.split(line, -1);
    }
}
