package com.healthrelay.alerting.alertmanager;

import java.util.Objects;

public record AlertmanagerOverride(String group, AlertmanagerConfig config) {
    public AlertmanagerOverride {
        group = group == null ? "" : group;
        Objects.requireNonNull(config, "config is required");
    }

    public boolean appliesTo(String endpointGroup) {
        return group.equals(endpointGroup == null ? "" : endpointGroup);
    }
}
