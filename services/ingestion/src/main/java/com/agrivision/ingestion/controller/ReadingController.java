package com.agrivision.ingestion.controller;

import com.agrivision.common.dto.reading.StoreReadingRequest;
import com.agrivision.common.dto.reading.StoreReadingResponse;
import com.agrivision.ingestion.service.ReadingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for field device readings.
 *
 * Endpoints:
 * - POST /api/store-reading - Store one sensor + image reading
 * - GET / - Liveness check
 */
@RestController
public class ReadingController {

    static final String HEALTH_MESSAGE = "AgriVision IoT API is running";

    private static final Logger log = LoggerFactory.getLogger(ReadingController.class);

    private final ReadingService readingService;

    public ReadingController(ReadingService readingService) {
        this.readingService = readingService;
    }

    /**
     * Store a single reading. Validation failures and storage errors are turned into error bodies
     * by {@link com.agrivision.ingestion.exception.GlobalExceptionHandler}.
     */
    @PostMapping(
            path = "/api/store-reading",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<StoreReadingResponse>> storeReading(@RequestBody StoreReadingRequest request) {
        log.debug("Received reading: field_id={}", request.fieldId());

        return readingService.storeReading(request)
                .map(ResponseEntity::ok);
    }

    @GetMapping(path = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok(HEALTH_MESSAGE));
    }
}
