package com.agrivision.ingestion.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One stored sensor + image sample. Not bound to a fixed collection: every field id gets its
 * own collection, chosen at insert time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReadingDocument {

    @Id
    private String id;

    @Field("field_id")
    private String fieldId;

    @Field("soil_moisture")
    private double soilMoisture;

    @Field("temperature")
    private double temperature;

    @Field("humidity")
    private double humidity;

    /**
     * The image exactly as the device sent it. Duplicates the file on disk and can reach several
     * megabytes per document; kept because existing consumers read it from the collection.
     */
    @Field("image_base64")
    private Object imageBase64;

    @Field("saved_file")
    private String savedFile;

    @Field("created_at")
    private Instant createdAt;
}
