package com.healthrelay.alerting.exception;

public class ProviderConfigException extends AlertingException {
    public ProviderConfigException(String message) {
        super(message);
    }

    public ProviderConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
