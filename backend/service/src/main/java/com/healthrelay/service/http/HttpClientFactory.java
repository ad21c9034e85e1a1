package com.healthrelay.service.http;

import com.healthrelay.core.model.ClientConfig;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.Map;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(ClientConfig clientConfig) {
        return create(clientConfig, System.getenv());
    }

    static HttpClient create(ClientConfig clientConfig, Map<String, String> environment) {
        ClientConfig cfg = clientConfig == null ? ClientConfig.defaults() : clientConfig;
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(cfg.timeoutOrDefault())
                .followRedirects(cfg.ignoreRedirect() ? HttpClient.Redirect.NEVER : HttpClient.Redirect.NORMAL);
        SSLContext sslContext = cfg.insecure() ? trustAllContext() : truststoreContext(cfg, environment);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        return builder.build();
    }

    private static SSLContext truststoreContext(ClientConfig cfg, Map<String, String> environment) {
        if (cfg.hasTruststore()) {
            if (cfg.truststorePassword() == null) {
                throw new IllegalStateException("client.truststore-password must be set when client.truststore-path is configured");
            }
            return loadTruststore(Path.of(cfg.truststorePath()), cfg.truststorePassword());
        }

        String truststorePath = environment.get("TRUSTSTORE_PATH");
        if (truststorePath == null || truststorePath.isBlank()) {
            return null;
        }
        String truststorePassword = environment.get("TRUSTSTORE_PASSWORD");
        if (truststorePassword == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }
        return loadTruststore(Path.of(truststorePath), truststorePassword);
    }

    private static SSLContext loadTruststore(Path path, String password) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(truststoreType(path));
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    // Certificate chains are not checked. Hostname verification stays on unless the JVM is started
    // with -Djdk.internal.httpclient.disableHostnameVerification.
    private static SSLContext trustAllContext() {
        TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build insecure SSL context", e);
        }
    }

    private static String truststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}
