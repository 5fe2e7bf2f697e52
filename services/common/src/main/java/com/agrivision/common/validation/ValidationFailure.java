package com.agrivision.common.validation;

/**
 * Reasons a reading payload is rejected, in the order they are checked.
 */
public enum ValidationFailure {

    INVALID_FIELD_ID("Invalid field_id. Use only letters, numbers, - and _ (max 100 chars)."),
    MISSING_IMAGE("image_base64 is required"),
    MISSING_SENSOR_VALUE("soil_moisture, temperature and humidity are required"),
    NON_NUMERIC_SENSOR_VALUE("Sensor values must be numeric");

    private final String message;

    ValidationFailure(String message) {
        this.message = message;
    }

    /**
     * Client-facing message returned in the error body.
     */
    public String getMessage() {
        return message;
    }
}
