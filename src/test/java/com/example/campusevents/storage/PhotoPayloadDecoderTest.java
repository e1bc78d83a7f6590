package com.example.campusevents.storage;

import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PhotoPayloadDecoder")
class PhotoPayloadDecoderTest {

    private final PhotoPayloadDecoder decoder = new PhotoPayloadDecoder(1);

    @Test
    @DisplayName("strips the data URL prefix before decoding")
    void decodesDataUrl() {
        String b64 = Base64.getEncoder().encodeToString("jpeg-bytes".getBytes(StandardCharsets.UTF_8));

        byte[] out = decoder.decode("data:image/jpeg;base64," + b64);

        assertThat(new String(out, StandardCharsets.UTF_8)).isEqualTo("jpeg-bytes");
    }

    @Test
    void decodesBareBase64() {
        assertThat(decoder.decode("AQID")).containsExactly(1, 2, 3);
    }

    @Test
    void rejectsMissingPayload() {
        assertThatThrownBy(() -> decoder.decode("  "))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_PHOTO_DATA);
        assertThatThrownBy(() -> decoder.decode("data:image/png;base64,"))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_PHOTO_DATA);
    }

    @Test
    void rejectsNonBase64() {
        assertThatThrownBy(() -> decoder.decode("not*base64!"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid base64 format");
    }

    @Test
    @DisplayName("checks the size before decoding")
    void rejectsOversizedPhoto() {
        byte[] big = new byte[1024 * 1024 + 3];
        String b64 = Base64.getEncoder().encodeToString(big);

        assertThatThrownBy(() -> decoder.decode(b64))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.PHOTO_TOO_LARGE);
    }

    @Test
    void estimatesDecodedSize() {
        assertThat(PhotoPayloadDecoder.estimateDecodedSize("AQID")).isEqualTo(3);
        assertThat(PhotoPayloadDecoder.estimateDecodedSize("AQI=")).isEqualTo(2);
        assertThat(PhotoPayloadDecoder.estimateDecodedSize("AQ==")).isEqualTo(1);
    }
}
