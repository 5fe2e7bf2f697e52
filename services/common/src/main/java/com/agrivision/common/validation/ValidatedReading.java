package com.agrivision.common.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A reading that passed every check. {@code fieldId} is the sanitized collection name;
 * {@code imageBase64} is the untouched payload value.
 */
public record ValidatedReading(
    String fieldId,
    double soilMoisture,
    double temperature,
    double humidity,
    JsonNode imageBase64
) {
}
