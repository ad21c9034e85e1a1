package com.healthrelay.alerting.alertmanager;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.healthrelay.alerting.api.AlertProvider;
import com.healthrelay.alerting.api.HttpClientProvider;
import com.healthrelay.alerting.exception.OverrideParseException;
import com.healthrelay.alerting.exception.ProviderConfigException;
import com.healthrelay.core.model.AlertDefinition;
import com.healthrelay.core.model.CheckResult;
import com.healthrelay.core.model.Endpoint;
import com.healthrelay.core.util.JsonUtils;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class AlertmanagerAlertProvider implements AlertProvider {
    static final String ALERT_NAME = "GatusEndpointDown";
    static final String JOB = "gatus";

    private static final ObjectReader OVERRIDE_READER = JsonUtils.yamlMapper()
            .readerFor(AlertmanagerConfig.class)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final AlertmanagerConfig defaultConfig;
    private final AlertDefinition defaultAlert;
    private final List<AlertmanagerOverride> overrides;
    private final AlertmanagerApiClient apiClient;
    private final Clock clock;

    public AlertmanagerAlertProvider(AlertmanagerConfig defaultConfig, HttpClientProvider httpClients) {
        this(defaultConfig, null, List.of(), httpClients, Clock.systemUTC());
    }

    public AlertmanagerAlertProvider(
            AlertmanagerConfig defaultConfig,
            AlertDefinition defaultAlert,
            List<AlertmanagerOverride> overrides,
            HttpClientProvider httpClients,
            Clock clock
    ) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig is required");
        this.defaultAlert = defaultAlert;
        this.overrides = overrides == null ? List.of() : List.copyOf(overrides);
        this.apiClient = new AlertmanagerApiClient(httpClients);
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public void validate() {
        defaultConfig.validate();
        for (AlertmanagerOverride override : overrides) {
            if (override.group().isBlank()) {
                throw new ProviderConfigException("alertmanager override group must not be empty; "
                        + "an override without a group would apply to every ungrouped endpoint, "
                        + "set those values on the provider defaults instead");
            }
        }
    }

    @Override
    public void send(Endpoint endpoint, AlertDefinition alert, CheckResult result, boolean resolved) {
        AlertmanagerConfig cfg = getConfig(endpoint.group(), alert);
        AlertmanagerAlert payload = buildAlert(cfg, endpoint, alert, result, resolved);
        apiClient.post(cfg, List.of(payload));
    }

    @Override
    public AlertDefinition defaultAlert() {
        return defaultAlert;
    }

    @Override
    public void validateOverrides(String group, AlertDefinition alert) {
        getConfig(group, alert);
    }

    // defaults, then the first override for the group, then the alert's own provider-override
    public AlertmanagerConfig getConfig(String group, AlertDefinition alert) {
        AlertmanagerConfig cfg = defaultConfig;
        for (AlertmanagerOverride override : overrides) {
            if (override.appliesTo(group)) {
                cfg = cfg.merge(override.config());
                break;
            }
        }
        if (alert != null && alert.hasProviderOverride()) {
            cfg = cfg.merge(parseOverride(alert.providerOverrideAsBytes()));
        }
        return cfg.validate();
    }

    AlertmanagerAlert buildAlert(
            AlertmanagerConfig cfg,
            Endpoint endpoint,
            AlertDefinition alert,
            CheckResult result,
            boolean resolved
    ) {
        Instant now = clock.instant();

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("alertname", ALERT_NAME);
        labels.put("instance", endpoint.url());
        labels.put("job", JOB);
        labels.put("severity", cfg.defaultSeverity());
        labels.put("endpoint", endpoint.name());
        if (endpoint.hasGroup()) {
            labels.put("group", endpoint.group());
        }
        // extras may replace the labels above
        if (cfg.extraLabels() != null) {
            labels.putAll(cfg.extraLabels());
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        Instant endsAt = null;
        if (resolved) {
            annotations.put("summary", "Endpoint " + endpoint.name() + " is now healthy");
            annotations.put("description", "Endpoint " + endpoint.name() + " (" + endpoint.url()
                    + ") has recovered and is now passing health checks");
            endsAt = now;
        } else {
            annotations.put("summary", "Endpoint " + endpoint.name() + " is down");
            String description = "Endpoint " + endpoint.name() + " (" + endpoint.url() + ") has failed health checks";
            if (result != null && result.hasErrors()) {
                description += ". Errors: " + String.join(", ", result.errors());
            }
            annotations.put("description", description);
        }
        if (alert != null && !alert.descriptionOrEmpty().isEmpty()) {
            annotations.put("alert_description", alert.description());
        }
        if (cfg.extraAnnotations() != null) {
            annotations.putAll(cfg.extraAnnotations());
        }

        return new AlertmanagerAlert(labels, annotations, now, endsAt);
    }

    private static AlertmanagerConfig parseOverride(byte[] raw) {
        try {
            AlertmanagerConfig parsed = OVERRIDE_READER.readValue(raw);
            return parsed == null ? AlertmanagerConfig.empty() : parsed;
        } catch (IOException e) {
            throw new OverrideParseException("Invalid alertmanager provider override: " + e.getMessage(), e);
        }
    }
}
