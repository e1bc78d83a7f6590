package com.example.campusevents.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Review state of a certificate. Uploads start PENDING, generated certificates are APPROVED.
 */
public enum CertificateStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    REJECTED("Rejected");

    private final String label;

    CertificateStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static CertificateStatus fromValue(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (CertificateStatus s : values()) {
            if (s.name().equals(v)) return s;
        }
        throw new IllegalArgumentException("Unknown certificate status: " + raw);
    }
}
