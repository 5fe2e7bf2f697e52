package com.agrivision.ingestion.service;

import com.agrivision.common.image.DecodedImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static reactor.core.scheduler.Schedulers.boundedElastic;

/**
 * Best-effort local copy of reading images.
 * <p>
 * Files are named {@code <fieldId>_<epochMillis>.jpg} inside the uploads directory, which is
 * created on first use. Two readings for the same field within one millisecond overwrite each
 * other.
 */
@Service
@Slf4j
public class ImageStorageService {

    private final Path uploadsDir;
    private final Clock clock;

    @Autowired
    public ImageStorageService(@Value("${agrivision.uploads-dir:uploads}") String uploadsDir) {
        this(Path.of(uploadsDir), Clock.systemUTC());
    }

    ImageStorageService(Path uploadsDir, Clock clock) {
        this.uploadsDir = uploadsDir;
        this.clock = clock;
        log.info("Reading images are saved to {}", uploadsDir.toAbsolutePath());
    }

    /**
     * Writes the image to disk.
     *
     * @return the path of the written file, or empty when the write failed
     */
    public Mono<String> save(String fieldId, DecodedImage image) {
        return Mono.fromCallable(() -> write(fieldId, image))
                .subscribeOn(boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Could not save image locally for field={}: {}", fieldId, e.getMessage());
                    return Mono.empty();
                });
    }

    private String write(String fieldId, DecodedImage image) throws IOException {
        Files.createDirectories(uploadsDir);
        Path file = uploadsDir.resolve(fieldId + "_" + clock.millis() + ".jpg");
        Files.write(file, image.data());
        log.debug("Saved {} byte image to {}", image.size(), file);
        return file.toString();
    }
}
