package com.healthrelay.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.healthrelay.alerting.alertmanager.AlertmanagerAlertProvider;
import com.healthrelay.alerting.alertmanager.AlertmanagerConfig;
import com.healthrelay.alerting.alertmanager.AlertmanagerOverride;
import com.healthrelay.alerting.api.HttpClientProvider;
import com.healthrelay.alerting.exception.AlertingException;
import com.healthrelay.core.model.AlertDefinition;
import com.healthrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public final class AlertingConfigLoader {
    private AlertingConfigLoader() {
    }

    public static AlertmanagerAlertProvider loadAlertmanager(Path file, HttpClientProvider httpClients) {
        return loadAlertmanager(file, httpClients, Clock.systemUTC());
    }

    public static AlertmanagerAlertProvider loadAlertmanager(Path file, HttpClientProvider httpClients, Clock clock) {
        JsonNode section = readTree(file).path("alerting").path("alertmanager");
        if (!section.isObject()) {
            throw new IllegalStateException("No alerting.alertmanager section in " + file);
        }

        try {
            ObjectMapper mapper = JsonUtils.yamlMapper();
            AlertmanagerConfig defaults = mapper.convertValue(section, AlertmanagerConfig.class);
            AlertDefinition defaultAlert = section.hasNonNull("default-alert")
                    ? mapper.convertValue(section.get("default-alert"), AlertDefinition.class)
                    : null;

            List<AlertmanagerOverride> overrides = new ArrayList<>();
            for (JsonNode node : section.path("overrides")) {
                overrides.add(new AlertmanagerOverride(
                        node.path("group").asText(""),
                        mapper.convertValue(node, AlertmanagerConfig.class)
                ));
            }

            AlertmanagerAlertProvider provider =
                    new AlertmanagerAlertProvider(defaults, defaultAlert, overrides, httpClients, clock);
            provider.validate();
            return provider;
        } catch (IllegalArgumentException | AlertingException e) {
            throw new IllegalStateException("Invalid alertmanager config in " + file + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode readTree(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = JsonUtils.yamlMapper().readTree(in);
            return root == null ? MissingNode.getInstance() : root;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + file, e);
        }
    }
}
