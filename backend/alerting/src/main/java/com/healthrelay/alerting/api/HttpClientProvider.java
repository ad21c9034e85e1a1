package com.healthrelay.alerting.api;

import com.healthrelay.core.model.ClientConfig;

import java.net.http.HttpClient;

@FunctionalInterface
public interface HttpClientProvider {
    // clientConfig may be null
    HttpClient clientFor(ClientConfig clientConfig);
}
