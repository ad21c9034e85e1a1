package com.healthrelay.alerting.exception;

public class PayloadSerializationException extends AlertingException {
    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
