package com.healthrelay.alerting.exception;

public class OverrideParseException extends AlertingException {
    public OverrideParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
