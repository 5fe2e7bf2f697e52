package com.agrivision.ingestion.service;

import com.agrivision.common.image.DecodedImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ImageStorageServiceTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateUploadsDirectoryAndWriteImage() throws Exception {
        // Given
        Path uploadsDir = tempDir.resolve("data").resolve("uploads");
        ImageStorageService service = new ImageStorageService(uploadsDir, FIXED_CLOCK);
        byte[] bytes = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};

        // When / Then
        Path expected = uploadsDir.resolve("Field_01_1700000000000.jpg");
        StepVerifier.create(service.save("Field_01", new DecodedImage("image/jpeg", bytes)))
                .expectNext(expected.toString())
                .verifyComplete();

        assertThat(Files.readAllBytes(expected)).isEqualTo(bytes);
    }

    @Test
    void shouldWriteEmptyImage() {
        ImageStorageService service = new ImageStorageService(tempDir, FIXED_CLOCK);

        StepVerifier.create(service.save("Field_01", new DecodedImage(null, new byte[0])))
                .expectNextMatches(path -> Files.exists(Path.of(path)))
                .verifyComplete();
    }

    @Test
    void shouldCompleteEmptyWhenDirectoryCannotBeCreated() throws Exception {
        // A regular file where the uploads directory should be
        Path blocked = Files.createFile(tempDir.resolve("uploads"));
        ImageStorageService service = new ImageStorageService(blocked, FIXED_CLOCK);

        StepVerifier.create(service.save("Field_01", new DecodedImage(null, new byte[]{1, 2, 3})))
                .verifyComplete();

        assertThat(Files.isRegularFile(blocked)).isTrue();
    }
}
