package com.healthrelay.alerting.exception;

public class AlertTransportException extends AlertingException {
    public AlertTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
