package com.healthrelay.alerting.alertmanager;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// endsAt stays null while the alert is firing and is then left out of the JSON
public record AlertmanagerAlert(
        @JsonProperty("labels") Map<String, String> labels,
        @JsonProperty("annotations") Map<String, String> annotations,
        @JsonProperty("startsAt") @JsonInclude(JsonInclude.Include.NON_NULL) Instant startsAt,
        @JsonProperty("endsAt") @JsonInclude(JsonInclude.Include.NON_NULL) Instant endsAt
) {
    public AlertmanagerAlert {
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }
}
