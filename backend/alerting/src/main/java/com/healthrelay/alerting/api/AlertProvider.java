package com.healthrelay.alerting.api;

import com.healthrelay.core.model.AlertDefinition;
import com.healthrelay.core.model.CheckResult;
import com.healthrelay.core.model.Endpoint;

public interface AlertProvider {
    void validate();

    void send(Endpoint endpoint, AlertDefinition alert, CheckResult result, boolean resolved);

    AlertDefinition defaultAlert();

    void validateOverrides(String group, AlertDefinition alert);
}
