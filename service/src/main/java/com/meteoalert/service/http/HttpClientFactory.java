package com.meteoalert.service.http;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Optional<TruststoreSettings> truststore) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        truststore.ifPresent(settings -> builder.sslContext(settings.sslContext()));
        return builder.build();
    }
}
