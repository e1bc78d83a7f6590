package com.example.campusevents.config;

import com.example.campusevents.enums.CertificateStatus;
import com.example.campusevents.enums.OnDutyStatus;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.storage.FileStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves stored uploads read-only under /uploads/** and binds the lowercase status values
 * used on the wire (?status=pending) in query parameters.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final FileStorageService fileStorageService;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler(FileStorageService.URL_PREFIX + "**")
                .addResourceLocations(fileStorageService.getRoot().toUri().toString());
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new Converter<String, StudentStatus>() {
            @Override
            public StudentStatus convert(String source) {
                return source.isBlank() ? null : StudentStatus.fromValue(source);
            }
        });
        registry.addConverter(new Converter<String, OnDutyStatus>() {
            @Override
            public OnDutyStatus convert(String source) {
                return source.isBlank() ? null : OnDutyStatus.fromValue(source);
            }
        });
        registry.addConverter(new Converter<String, CertificateStatus>() {
            @Override
            public CertificateStatus convert(String source) {
                return source.isBlank() ? null : CertificateStatus.fromValue(source);
            }
        });
    }
}
