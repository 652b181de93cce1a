package com.bko.sheetmirror.shared;

import java.time.Duration;

public record TransportSettings(String baseUrl, Duration connectTimeout, Duration responseTimeout) {
    public static final String DEFAULT_BASE_URL = "https://sheets.googleapis.com/v4";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(60);

    public TransportSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (connectTimeout == null) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
        if (responseTimeout == null) {
            responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        }
    }

    public static TransportSettings defaults() {
        return new TransportSettings(null, null, null);
    }
}
