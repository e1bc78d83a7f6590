package com.example.campusevents.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Photo proofs arrive as one base64 JSON string. Jackson caps string values at 20M chars by
 * default, which is below the configured photo limit, so the cap follows that limit instead.
 */
@Configuration
public class JacksonConfig {

    private static final Logger log = LoggerFactory.getLogger(JacksonConfig.class);

    private static final long MB = 1024L * 1024L;
    // data-URL prefix and padding
    private static final int HEADROOM_CHARS = 1024 * 1024;

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer photoPayloadStringLength(
            @Value("${app.attendance.max-photo-size-mb:50}") long maxPhotoSizeMb) {
        int maxLength = maxStringLength(maxPhotoSizeMb);
        log.info("JSON string values limited to {} chars", maxLength);
        return builder -> builder.postConfigurer(mapper -> mapper.getFactory()
                .setStreamReadConstraints(StreamReadConstraints.builder().maxStringLength(maxLength).build()));
    }

    static int maxStringLength(long maxPhotoSizeMb) {
        long maxBytes = (maxPhotoSizeMb > 0 ? maxPhotoSizeMb : 50) * MB;
        long base64Chars = (maxBytes + 2) / 3 * 4;
        long limit = Math.max(base64Chars + HEADROOM_CHARS, StreamReadConstraints.DEFAULT_MAX_STRING_LEN);
        return (int) Math.min(limit, Integer.MAX_VALUE);
    }
}
