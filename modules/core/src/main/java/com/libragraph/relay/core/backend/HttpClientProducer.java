package com.libragraph.relay.core.backend;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Shared JDK {@link HttpClient} for backend and broker calls.
 */
@ApplicationScoped
public class HttpClientProducer {

    @ConfigProperty(name = "relay.http.connect-timeout", defaultValue = "5s")
    Duration connectTimeout;

    @Produces
    @Singleton
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }
}
