package com.healthrelay.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

// Interpreted only by the HTTP client factory; providers pass it through untouched.
public record ClientConfig(
        @JsonProperty("insecure") boolean insecure,
        @JsonProperty("ignore-redirect") boolean ignoreRedirect,
        @JsonProperty("timeout") Duration timeout,
        @JsonProperty("truststore-path") String truststorePath,
        @JsonProperty("truststore-password") String truststorePassword
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig(boolean insecure, boolean ignoreRedirect, Duration timeout) {
        this(insecure, ignoreRedirect, timeout, null, null);
    }

    public static ClientConfig defaults() {
        return new ClientConfig(false, false, DEFAULT_TIMEOUT);
    }

    public Duration timeoutOrDefault() {
        return timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public boolean hasTruststore() {
        return truststorePath != null && !truststorePath.isBlank();
    }

    @Override
    public String toString() {
        return "ClientConfig[insecure=" + insecure + ", ignoreRedirect=" + ignoreRedirect
                + ", timeout=" + timeout + ", truststorePath=" + truststorePath + "]";
    }
}
