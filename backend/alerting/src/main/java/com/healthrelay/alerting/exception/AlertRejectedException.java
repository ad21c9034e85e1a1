package com.healthrelay.alerting.exception;

public class AlertRejectedException extends AlertingException {
    private final int statusCode;
    private final String responseBody;

    public AlertRejectedException(String receiver, int statusCode, String responseBody) {
        super(receiver + " returned status " + statusCode + ": " + (responseBody == null ? "" : responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
