package com.healthrelay.alerting.exception;

public class AlertingException extends RuntimeException {
    public AlertingException(String message) {
        super(message);
    }

    public AlertingException(String message, Throwable cause) {
        super(message, cause);
    }
}
