package com.agrivision.ingestion.service;

import com.agrivision.common.dto.reading.StoreReadingRequest;
import com.agrivision.common.dto.reading.StoreReadingResponse;
import com.agrivision.common.image.Base64ImageDecoder;
import com.agrivision.common.image.DecodedImage;
import com.agrivision.common.util.JsonUtil;
import com.agrivision.common.validation.InvalidReadingException;
import com.agrivision.common.validation.ReadingValidator;
import com.agrivision.common.validation.ValidatedReading;
import com.agrivision.ingestion.model.ReadingDocument;
import com.agrivision.ingestion.repository.ReadingRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;

/**
 * Validates field readings, keeps a local copy of the image and stores the reading in the
 * collection of its field.
 * <p>
 * The image copy is optional and never fails a request; the insert is required and its errors
 * propagate to the caller.
 */
@Service
public class ReadingService {

    private static final Logger log = LoggerFactory.getLogger(ReadingService.class);

    private final ReadingRepository readingRepository;
    private final ImageStorageService imageStorageService;

    // Metrics
    private final Counter readingsReceived;
    private final Counter readingsStored;
    private final Counter readingsRejected;
    private final Counter readingsFailed;
    private final Counter imagesSaved;
    private final Counter imagesSkipped;
    private final Timer insertLatency;

    public ReadingService(
            ReadingRepository readingRepository,
            ImageStorageService imageStorageService,
            MeterRegistry meterRegistry) {
        this.readingRepository = readingRepository;
        this.imageStorageService = imageStorageService;

        this.readingsReceived = Counter.builder("readings.received")
                .description("Number of readings received")
                .register(meterRegistry);

        this.readingsStored = Counter.builder("readings.stored")
                .description("Number of readings inserted into MongoDB")
                .register(meterRegistry);

        this.readingsRejected = Counter.builder("readings.rejected")
                .description("Number of readings that failed validation")
                .register(meterRegistry);

        this.readingsFailed = Counter.builder("readings.failed")
                .description("Number of valid readings that could not be stored")
                .register(meterRegistry);

        this.imagesSaved = Counter.builder("readings.images.saved")
                .description("Number of reading images written to local disk")
                .register(meterRegistry);

        this.imagesSkipped = Counter.builder("readings.images.skipped")
                .description("Number of reading images not written (undecodable or write failure)")
                .register(meterRegistry);

        this.insertLatency = Timer.builder("readings.insert.latency")
                .description("Time taken to insert a reading into MongoDB")
                .register(meterRegistry);
    }

    /**
     * Validate, persist the image and insert a single reading.
     *
     * @return the insert result; errors with {@link InvalidReadingException} when the payload is
     * rejected, before anything is written
     */
    public Mono<StoreReadingResponse> storeReading(StoreReadingRequest request) {
        return Mono.defer(() -> {
            readingsReceived.increment();

            ValidatedReading reading;
            try {
                reading = ReadingValidator.validate(request);
            } catch (InvalidReadingException e) {
                readingsRejected.increment();
                log.debug("Rejected reading: {}", e.getFailure());
                return Mono.error(e);
            }

            return saveImage(reading)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(savedFile -> insert(reading, savedFile.orElse(null)));
        });
    }

    private Mono<String> saveImage(ValidatedReading reading) {
        Optional<DecodedImage> image = decodeImage(reading);
        if (image.isEmpty()) {
            imagesSkipped.increment();
            return Mono.empty();
        }
        return imageStorageService.save(reading.fieldId(), image.get())
                .doOnNext(path -> imagesSaved.increment())
                .switchIfEmpty(Mono.fromRunnable(imagesSkipped::increment));
    }

    private Optional<DecodedImage> decodeImage(ValidatedReading reading) {
        if (!reading.imageBase64().isTextual()) {
            log.warn("Image for field={} is not a base64 string ({}), skipping local copy",
                    reading.fieldId(), reading.imageBase64().getNodeType());
            return Optional.empty();
        }
        return Base64ImageDecoder.decode(reading.imageBase64().textValue());
    }

    private Mono<StoreReadingResponse> insert(ValidatedReading reading, String savedFile) {
        String collection = reading.fieldId();
        ReadingDocument document = ReadingDocument.builder()
                .fieldId(collection)
                .soilMoisture(reading.soilMoisture())
                .temperature(reading.temperature())
                .humidity(reading.humidity())
                .imageBase64(JsonUtil.toPlainValue(reading.imageBase64()))
                .savedFile(savedFile)
                .createdAt(Instant.now())
                .build();

        return Mono.defer(() -> {
                    Timer.Sample sample = Timer.start();
                    return readingRepository.insert(document, collection)
                            .doFinally(signal -> sample.stop(insertLatency));
                })
                .map(saved -> {
                    readingsStored.increment();
                    log.info("Inserted reading: collection={}, id={}, soil={}, temp={}, hum={}",
                            collection, saved.getId(), saved.getSoilMoisture(),
                            saved.getTemperature(), saved.getHumidity());
                    return StoreReadingResponse.success(saved.getId(), collection, savedFile);
                })
                .doOnError(error -> {
                    readingsFailed.increment();
                    log.error("Failed to insert reading into collection={}: {}", collection, error.getMessage());
                });
    }
}
