package com.healthrelay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.healthrelay.core.util.JsonUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AlertDefinition(
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("failure-threshold") Integer failureThreshold,
        @JsonProperty("success-threshold") Integer successThreshold,
        @JsonProperty("send-on-resolved") Boolean sendOnResolved,
        @JsonProperty("provider-override") Map<String, Object> providerOverride
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    public AlertDefinition {
        providerOverride = providerOverride == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(providerOverride));
    }

    public static AlertDefinition withDescription(String description) {
        return new AlertDefinition(description, null, null, null, null, null);
    }

    public static AlertDefinition empty() {
        return new AlertDefinition(null, null, null, null, null, null);
    }

    public AlertDefinition withProviderOverride(Map<String, Object> override) {
        return new AlertDefinition(description, enabled, failureThreshold, successThreshold, sendOnResolved, override);
    }

    public AlertDefinition withDefaults(AlertDefinition defaultAlert) {
        if (defaultAlert == null) {
            return this;
        }
        return new AlertDefinition(
                description != null ? description : defaultAlert.description(),
                enabled != null ? enabled : defaultAlert.enabled(),
                isSet(failureThreshold) ? failureThreshold : defaultAlert.failureThreshold(),
                isSet(successThreshold) ? successThreshold : defaultAlert.successThreshold(),
                sendOnResolved != null ? sendOnResolved : defaultAlert.sendOnResolved(),
                providerOverride != null ? providerOverride : defaultAlert.providerOverride()
        );
    }

    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isSendOnResolved() {
        return Boolean.TRUE.equals(sendOnResolved);
    }

    public int failureThresholdOrDefault() {
        return isSet(failureThreshold) ? failureThreshold : DEFAULT_FAILURE_THRESHOLD;
    }

    public int successThresholdOrDefault() {
        return isSet(successThreshold) ? successThreshold : DEFAULT_SUCCESS_THRESHOLD;
    }

    public boolean hasProviderOverride() {
        return providerOverride != null && !providerOverride.isEmpty();
    }

    public byte[] providerOverrideAsBytes() {
        if (!hasProviderOverride()) {
            return new byte[0];
        }
        try {
            return JsonUtils.yamlMapper().writeValueAsBytes(providerOverride);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render provider override", e);
        }
    }

    private static boolean isSet(Integer threshold) {
        return threshold != null && threshold > 0;
    }
}
