package com.bko.sheetmirror.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class SettingsConfiguration {

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        GoogleSettings google = new GoogleSettings(
                envConfig.get("google.spreadsheet_id"),
                envConfig.get("google.service_account_key_path"),
                parseScopes(envConfig.get("google.scopes"))
        );
        TransportSettings transport = new TransportSettings(
                envConfig.get("sheets.base_url"),
                parseSeconds(envConfig.get("sheets.connect_timeout_seconds")),
                parseSeconds(envConfig.get("sheets.response_timeout_seconds"))
        );
        return new AppSettings(google, transport);
    }

    static List<String> parseScopes(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid timeout in seconds: " + value, e);
        }
    }
}
