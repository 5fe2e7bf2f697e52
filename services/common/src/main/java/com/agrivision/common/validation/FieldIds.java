package com.agrivision.common.validation;

import com.agrivision.common.util.TextUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Allow-list sanitization of field identifiers.
 * <p>
 * A field id becomes a MongoDB collection name, so this is the only gate between caller input and
 * storage addressing. Nothing is escaped or rewritten: a value either passes as-is (trimmed) or is
 * rejected.
 */
public final class FieldIds {

    public static final int MAX_LENGTH = 100;

    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9_-]{1," + MAX_LENGTH + "}$");

    private FieldIds() {}

    /**
     * Returns the trimmed field id when it is a JSON string made only of letters, digits,
     * {@code _} and {@code -}, 1 to 100 characters long.
     */
    public static Optional<String> sanitize(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return sanitize(value.textValue());
    }

    public static Optional<String> sanitize(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = TextUtil.trim(value);
        if (!ALLOWED.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }
}
