package com.healthrelay.alerting.alertmanager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.healthrelay.alerting.api.HttpClientProvider;
import com.healthrelay.alerting.exception.AlertRejectedException;
import com.healthrelay.alerting.exception.AlertTransportException;
import com.healthrelay.alerting.exception.PayloadSerializationException;
import com.healthrelay.alerting.exception.ProviderConfigException;
import com.healthrelay.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

public final class AlertmanagerApiClient {
    private static final Logger LOGGER = Logger.getLogger(AlertmanagerApiClient.class.getName());
    static final String ALERTS_PATH = "/api/v2/alerts";

    private final HttpClientProvider httpClients;

    public AlertmanagerApiClient(HttpClientProvider httpClients) {
        this.httpClients = Objects.requireNonNull(httpClients, "httpClients is required");
    }

    public void post(AlertmanagerConfig cfg, List<AlertmanagerAlert> alerts) {
        byte[] payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsBytes(alerts);
        } catch (JsonProcessingException e) {
            throw new PayloadSerializationException("Failed to marshal alerts", e);
        }

        String url = alertsUrl(cfg.url());
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                    .timeout(cfg.timeout())
                    .header("Content-Type", "application/json")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ProviderConfigException("Invalid Alertmanager URL: " + cfg.url(), e);
        }

        HttpClient httpClient;
        try {
            httpClient = httpClients.clientFor(cfg.client());
        } catch (RuntimeException e) {
            throw new ProviderConfigException("Failed to build HTTP client for Alertmanager: " + describe(e), e);
        }

        LOGGER.fine(() -> "Posting " + alerts.size() + " alert(s) to " + url);
        HttpResponse<String> response;
        try {
            // ofString reads the body to the end, which releases the connection on every path
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AlertTransportException("Failed to send request to Alertmanager at " + url + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertTransportException("Interrupted while sending request to Alertmanager at " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOGGER.fine(() -> "Alertmanager at " + url + " rejected alerts with status " + status);
            throw new AlertRejectedException("Alertmanager", status, response.body());
        }
    }

    static String alertsUrl(String configuredUrl) {
        String url = configuredUrl.endsWith("/")
                ? configuredUrl.substring(0, configuredUrl.length() - 1)
                : configuredUrl;
        if (!url.endsWith(ALERTS_PATH)) {
            url += ALERTS_PATH;
        }
        return url;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
