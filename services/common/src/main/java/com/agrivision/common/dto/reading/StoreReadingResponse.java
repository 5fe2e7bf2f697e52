package com.agrivision.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for a stored reading. {@code saved_file} is always serialized, as {@code null} when
 * no image file was written.
 */
public record StoreReadingResponse(
    @JsonProperty("success")
    boolean success,

    @JsonProperty("insertedId")
    String insertedId,

    @JsonProperty("collection")
    String collection,

    @JsonProperty("saved_file")
    String savedFile
) {
    public static StoreReadingResponse success(String insertedId, String collection, String savedFile) {
        return new StoreReadingResponse(true, insertedId, collection, savedFile);
    }
}
