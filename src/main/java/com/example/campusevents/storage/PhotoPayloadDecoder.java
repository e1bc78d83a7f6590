package com.example.campusevents.storage;

import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Validates and decodes base64 photo payloads sent by the attendance camera screen.
 */
@Component
public class PhotoPayloadDecoder {

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");
    private static final long MB = 1024L * 1024L;

    private final long maxBytes;

    public PhotoPayloadDecoder(@Value("${app.attendance.max-photo-size-mb:50}") long maxSizeMb) {
        this.maxBytes = (maxSizeMb > 0 ? maxSizeMb : 50) * MB;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    /**
     * @param photoData base64 text, optionally prefixed with {@code data:image/...;base64,}
     * @return decoded image bytes
     * @throws ValidationException INVALID_PHOTO_DATA or PHOTO_TOO_LARGE
     */
    public byte[] decode(String photoData) {
        if (photoData == null || photoData.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_PHOTO_DATA, "Photo data is required");
        }
        String base64 = stripDataUrlPrefix(photoData.trim());
        if (base64.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_PHOTO_DATA, "Photo data is required");
        }

        long estimated = estimateDecodedSize(base64);
        if (estimated > maxBytes) {
            throw new ValidationException(ErrorCode.PHOTO_TOO_LARGE,
                    String.format("Photo size exceeds maximum of %.1fMB", maxBytes / (double) MB));
        }
        if (!BASE64.matcher(base64).matches()) {
            throw new ValidationException(ErrorCode.INVALID_PHOTO_DATA, "Invalid base64 format");
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ErrorCode.INVALID_PHOTO_DATA, "Invalid base64 format", ex);
        }
    }

    static String stripDataUrlPrefix(String data) {
        int comma = data.indexOf(',');
        return comma >= 0 ? data.substring(comma + 1) : data;
    }

    static long estimateDecodedSize(String base64) {
        int padding = 0;
        if (base64.endsWith("==")) padding = 2;
        else if (base64.endsWith("=")) padding = 1;
        return (base64.length() * 3L) / 4 - padding;
    }
}
