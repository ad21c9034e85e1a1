package com.healthrelay.service.http;

import com.healthrelay.alerting.api.HttpClientProvider;
import com.healthrelay.core.model.ClientConfig;

import java.net.http.HttpClient;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SharedHttpClients implements HttpClientProvider {
    private final Map<ClientConfig, HttpClient> clients = new ConcurrentHashMap<>();

    @Override
    public HttpClient clientFor(ClientConfig clientConfig) {
        ClientConfig key = clientConfig == null ? ClientConfig.defaults() : clientConfig;
        return clients.computeIfAbsent(key, HttpClientFactory::create);
    }

    int size() {
        return clients.size();
    }
}
