package com.agrivision.common.validation;

import com.agrivision.common.util.TextUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Numeric coercion of sensor values as sent by field devices.
 * <p>
 * Firmware in the field posts readings either as JSON numbers or as strings (often straight from
 * a sensor driver's formatted output), so strings are coerced with the lenient rules devices rely
 * on: surrounding whitespace is ignored, a blank string reads as {@code 0}, {@code 0x}/{@code 0o}/
 * {@code 0b} integer literals are accepted, and booleans read as {@code 1}/{@code 0}.
 * Anything else yields {@link Double#NaN}.
 * <p>
 * Arrays and objects are never unwrapped: {@code [5]} is NaN, not 5, and {@code []} is NaN, not 0.
 * Loosely typed clients coerce single-element arrays; readings carrying them are rejected here
 * on purpose.
 */
public final class SensorValues {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("[+-]?Infinity");
    private static final Pattern RADIX_LITERAL = Pattern.compile("0([xX][0-9a-fA-F]+|[oO][0-7]+|[bB][01]+)");

    private SensorValues() {}

    /**
     * Coerces a payload value to a double. Never throws; unparseable input returns NaN.
     */
    public static double coerce(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Double.NaN;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1 : 0;
        }
        if (value.isTextual()) {
            return coerce(value.textValue());
        }
        return Double.NaN;
    }

    public static double coerce(String text) {
        String trimmed = TextUtil.trim(text);
        if (trimmed.isEmpty()) {
            return 0;
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if (INFINITY.matcher(trimmed).matches()) {
            return trimmed.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (RADIX_LITERAL.matcher(trimmed).matches()) {
            return new BigInteger(trimmed.substring(2), radixOf(trimmed.charAt(1))).doubleValue();
        }
        return Double.NaN;
    }

    /**
     * True for values a reading may carry: not NaN and not infinite.
     */
    public static boolean isUsable(double value) {
        return Double.isFinite(value);
    }

    private static int radixOf(char prefix) {
        return switch (Character.toLowerCase(prefix)) {
            case 'x' -> 16;
            case 'o' -> 8;
            case 'b' -> 2;
            default -> throw new IllegalArgumentException("Unsupported radix prefix: " + prefix);
        };
    }
}
