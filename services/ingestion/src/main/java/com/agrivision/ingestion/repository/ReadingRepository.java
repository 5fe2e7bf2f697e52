package com.agrivision.ingestion.repository;

import com.agrivision.ingestion.model.ReadingDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Stores readings in per-field collections. Collection names must already be sanitized field ids.
 */
@Repository
@RequiredArgsConstructor
public class ReadingRepository {

    private final ReactiveMongoOperations mongoOperations;

    /**
     * Inserts the reading into {@code collectionName}, creating the collection on first use.
     * The returned document carries the store-assigned id.
     */
    public Mono<ReadingDocument> insert(ReadingDocument reading, String collectionName) {
        return mongoOperations.insert(reading, collectionName);
    }
}
