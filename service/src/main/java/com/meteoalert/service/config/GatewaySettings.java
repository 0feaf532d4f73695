package com.meteoalert.service.config;

import com.meteoalert.service.http.TruststoreSettings;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Endpoints and credentials of the delivery system, read from the environment.
 *
 * @param usersBaseUrl    base URL of the API that owns login, vocabularies and alert import
 * @param dispatchBaseUrl base URL of the module that fans alerts out to subscribers
 */
public record GatewaySettings(
        String usersBaseUrl,
        String dispatchBaseUrl,
        String email,
        String password,
        Duration requestTimeout,
        Optional<TruststoreSettings> truststore
) {
    public static GatewaySettings fromEnvironment(Map<String, String> env) {
        return new GatewaySettings(
                trimSlash(env.getOrDefault("API_BASE_URL", "http://localhost:8002")),
                trimSlash(env.getOrDefault("ENVIOS_API_BASE_URL", "http://localhost:8000")),
                env.getOrDefault("API_EMAIL", ""),
                env.getOrDefault("API_PASSWORD", ""),
                Duration.ofSeconds(Long.parseLong(env.getOrDefault("API_TIMEOUT_SECONDS", "30"))),
                TruststoreSettings.fromEnvironment(env)
        );
    }

    private static String trimSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
