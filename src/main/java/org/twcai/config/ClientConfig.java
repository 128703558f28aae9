package org.twcai.config;

import lombok.Getter;
import lombok.ToString;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;

import java.time.Duration;

/**
 * Immutable connection context shared by every endpoint group.
 *
 * <p>The transport is safe for concurrent use, so one instance can serve any number of in-flight calls.</p>
 */
@Getter
@ToString
public final class ClientConfig {

    private final String baseUrl;

    @ToString.Exclude
    private final String token;

    private final Duration timeout;

    @ToString.Exclude
    private final CloseableHttpClient httpClient;

    public ClientConfig(String baseUrl, String token, Duration timeout, CloseableHttpClient httpClient) {
        this.baseUrl = baseUrl;
        this.token = token;
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    public String authorizationHeader() {
        return "Bearer " + token;
    }
}
