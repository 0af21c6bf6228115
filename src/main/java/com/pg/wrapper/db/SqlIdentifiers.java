package com.pg.wrapper.db;

import java.util.regex.Pattern;

/**
 * Validation for identifiers that are spliced into generated SQL rather than bound as parameters.
 */
public final class SqlIdentifiers {

    /** PostgreSQL truncates identifiers at NAMEDATALEN - 1 bytes. */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]*$");

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * Validates an unquoted identifier, optionally schema-qualified ({@code schema.table}).
     *
     * @param identifier the identifier to validate
     * @throws IllegalArgumentException if any part is blank, too long, or contains characters
     *                                  that would require quoting
     */
    public static void validate(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        String[] parts = identifier.split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Identifier has too many qualifiers: '" + identifier + "'");
        }
        for (String part : parts) {
            if (part.length() > MAX_IDENTIFIER_LENGTH) {
                throw new IllegalArgumentException(
                        "Identifier exceeds maximum length of " + MAX_IDENTIFIER_LENGTH +
                                " characters (was " + part.length() + ")");
            }
            if (!PLAIN_IDENTIFIER.matcher(part).matches()) {
                throw new IllegalArgumentException(
                        "Identifier must contain only letters, digits, '_' and '$', got: '" + identifier + "'");
            }
        }
    }
}
