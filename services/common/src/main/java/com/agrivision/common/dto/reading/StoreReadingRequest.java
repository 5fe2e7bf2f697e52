package com.agrivision.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reading payload posted by a field device.
 * <p>
 * Every property is kept as a raw {@link JsonNode}: devices send sensor values both as numbers
 * and as strings, and the field id must be rejected (not coerced) when it is not a string.
 * Typing happens in {@link com.agrivision.common.validation.ReadingValidator}.
 *
 * Example JSON:
 * {
 *   "field_id": "Field_01",
 *   "soil_moisture": "42.5",
 *   "temperature": 21,
 *   "humidity": 60,
 *   "image_base64": "data:image/jpeg;base64,/9j/4AAQ..."
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreReadingRequest(
    @JsonProperty("field_id")
    JsonNode fieldId,

    @JsonProperty("soil_moisture")
    JsonNode soilMoisture,

    @JsonProperty("temperature")
    JsonNode temperature,

    @JsonProperty("humidity")
    JsonNode humidity,

    @JsonProperty("image_base64")
    JsonNode imageBase64,

    // Accepted for compatibility with older firmware; the target database comes from configuration.
    @JsonProperty("database_name")
    JsonNode databaseName
) {
}
