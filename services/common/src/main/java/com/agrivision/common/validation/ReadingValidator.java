package com.agrivision.common.validation;

import com.agrivision.common.dto.reading.StoreReadingRequest;
import com.agrivision.common.util.JsonUtil;

import java.util.stream.DoubleStream;
import java.util.stream.Stream;

/**
 * Ordered validation of a reading payload. Checks run in a fixed order and the first failure is
 * reported:
 * <ol>
 *     <li>field id is a valid collection name</li>
 *     <li>image is present</li>
 *     <li>all three sensor values are present</li>
 *     <li>all three sensor values coerce to finite numbers</li>
 * </ol>
 */
public final class ReadingValidator {

    private ReadingValidator() {}

    /**
     * @throws InvalidReadingException on the first failed check
     */
    public static ValidatedReading validate(StoreReadingRequest request) {
        String fieldId = FieldIds.sanitize(request.fieldId())
                .orElseThrow(() -> new InvalidReadingException(ValidationFailure.INVALID_FIELD_ID));

        if (JsonUtil.isAbsent(request.imageBase64())) {
            throw new InvalidReadingException(ValidationFailure.MISSING_IMAGE);
        }

        if (Stream.of(request.soilMoisture(), request.temperature(), request.humidity())
                .anyMatch(JsonUtil::isAbsent)) {
            throw new InvalidReadingException(ValidationFailure.MISSING_SENSOR_VALUE);
        }

        double soilMoisture = SensorValues.coerce(request.soilMoisture());
        double temperature = SensorValues.coerce(request.temperature());
        double humidity = SensorValues.coerce(request.humidity());

        if (!DoubleStream.of(soilMoisture, temperature, humidity).allMatch(SensorValues::isUsable)) {
            throw new InvalidReadingException(ValidationFailure.NON_NUMERIC_SENSOR_VALUE);
        }

        return new ValidatedReading(fieldId, soilMoisture, temperature, humidity, request.imageBase64());
    }
}
