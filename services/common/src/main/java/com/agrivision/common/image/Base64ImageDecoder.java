package com.agrivision.common.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the image carried by a reading. Accepts either bare base64 or a data URI
 * ({@code data:image/jpeg;base64,<payload>}). Both the standard and the URL-safe alphabet are
 * accepted, padding is optional and embedded whitespace (line-wrapped encoders) is ignored.
 * <p>
 * Decoding problems are reported as an empty result, never as an exception: a reading with an
 * unreadable image is still a valid reading.
 */
public final class Base64ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(Base64ImageDecoder.class);

    private static final Pattern DATA_URI = Pattern.compile("^data:([A-Za-z+/-]+);base64,(.+)$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Base64ImageDecoder() {}

    /**
     * Decodes an image payload.
     *
     * @return the decoded image, or empty when the payload is not valid base64
     */
    public static Optional<DecodedImage> decode(String payload) {
        if (payload == null) {
            return Optional.empty();
        }

        String mimeType = null;
        String base64 = payload;
        Matcher matcher = DATA_URI.matcher(payload);
        if (matcher.matches()) {
            mimeType = matcher.group(1);
            base64 = matcher.group(2);
        }

        String compact = WHITESPACE.matcher(base64).replaceAll("");
        try {
            return Optional.of(new DecodedImage(mimeType, decoderFor(compact).decode(compact)));
        } catch (IllegalArgumentException e) {
            log.warn("Error decoding base64 image: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Base64.Decoder decoderFor(String base64) {
        if (base64.indexOf('-') >= 0 || base64.indexOf('_') >= 0) {
            return Base64.getUrlDecoder();
        }
        return Base64.getDecoder();
    }
}
