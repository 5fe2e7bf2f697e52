package com.agrivision.common.image;

/**
 * Raw image bytes extracted from a reading payload.
 *
 * @param mimeType type declared by a data URI, or {@code null} for bare base64
 * @param data     decoded bytes, possibly empty
 */
public record DecodedImage(String mimeType, byte[] data) {

    public int size() {
        return data.length;
    }
}
