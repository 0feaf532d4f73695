package com.meteoalert.service.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.meteoalert.core.util.JsonUtils;
import com.meteoalert.engine.export.AlertExportRecord;
import com.meteoalert.engine.export.VocabularyEntry;
import com.meteoalert.service.config.GatewaySettings;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public final class HttpDeliveryGateway implements DeliveryGateway {
    private static final Logger LOGGER = Logger.getLogger(HttpDeliveryGateway.class.getName());

    private final HttpClient httpClient;
    private final GatewaySettings settings;
    private String token;

    public HttpDeliveryGateway(HttpClient httpClient, GatewaySettings settings) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    @Override
    public void login() {
        if (settings.email().isBlank() || settings.password().isBlank()) {
            throw new IllegalStateException("API_EMAIL and API_PASSWORD must be set");
        }
        Map<String, String> credentials = new LinkedHashMap<>();
        credentials.put("email", settings.email());
        credentials.put("senha", settings.password());
        URI uri = URI.create(settings.usersBaseUrl() + "/usuarios/login");
        HttpRequest request = jsonRequest(uri)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(credentials)))
                .build();
        try {
            String body = send(request);
            String received = JsonUtils.objectMapper().readTree(body).path("token").asText("");
            if (received.isBlank()) {
                throw new IllegalStateException("Login response from " + uri + " carried no token");
            }
            token = received;
            LOGGER.info("Authenticated against " + settings.usersBaseUrl());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Login request failed", e);
        }
    }

    @Override
    public List<VocabularyEntry> fetchEvents() {
        return fetchVocabulary("/eventos");
    }

    @Override
    public List<VocabularyEntry> fetchCities() {
        return fetchVocabulary("/cidades");
    }

    @Override
    public String importAlerts(List<AlertExportRecord> alerts) {
        URI uri = URI.create(settings.usersBaseUrl() + "/avisos/lote");
        HttpRequest request = authorized(jsonRequest(uri))
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(Map.of("avisos", alerts))))
                .build();
        String body = send(request);
        LOGGER.info("Imported " + alerts.size() + " alerts");
        return body;
    }

    @Override
    public void startDispatch() {
        URI uri = URI.create(settings.dispatchBaseUrl() + "/alerts/start");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .POST(HttpRequest.BodyPublishers.noBody())
                .timeout(settings.requestTimeout())
                .build();
        send(request);
        LOGGER.info("Dispatch started at " + uri);
    }

    private List<VocabularyEntry> fetchVocabulary(String path) {
        URI uri = URI.create(settings.usersBaseUrl() + path);
        HttpRequest request = authorized(jsonRequest(uri)).GET().build();
        try {
            JsonNode root = JsonUtils.objectMapper().readTree(send(request));
            if (!root.isArray()) {
                throw new IllegalStateException("Expected a JSON array from " + uri);
            }
            return JsonUtils.objectMapper().convertValue(root, new TypeReference<>() {
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Vocabulary request failed for " + uri, e);
        }
    }

    private HttpRequest.Builder jsonRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (token == null) {
            throw new IllegalStateException("Not authenticated; call login() first");
        }
        return builder.header("Authorization", "Bearer " + token);
    }

    private String send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new IllegalStateException("Request to " + request.uri() + " failed with status "
                        + response.statusCode() + ": " + response.body());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Request to " + request.uri() + " interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Request to " + request.uri() + " failed", e);
        }
    }
}
