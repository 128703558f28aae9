package org.twcai.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.twcai.CloudAiClient;
import org.twcai.service.IAgentService;
import org.twcai.service.IConversationService;
import org.twcai.service.IResponseService;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Spring Boot wiring for the client, driven by {@code twcai.*} properties.
 */
@AutoConfiguration
@EnableConfigurationProperties(TwcaiProperties.class)
@ConditionalOnProperty(prefix = "twcai", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HttpClientConfig {

    @Bean
    @ConditionalOnMissingBean(name = "twcaiHttpClient")
    public CloseableHttpClient twcaiHttpClient(TwcaiProperties properties) {
        return pooledHttpClient(properties.getMaxConnections(), properties.getMaxConnectionsPerRoute(),
                timeout(properties));
    }

    @Bean
    @ConditionalOnMissingBean
    public CloudAiClient cloudAiClient(TwcaiProperties properties, CloseableHttpClient twcaiHttpClient) {
        return CloudAiClient.builder()
                .baseUrl(properties.getBaseUrl())
                .token(properties.getToken())
                .timeout(timeout(properties))
                .httpClient(twcaiHttpClient)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IAgentService agentService(CloudAiClient cloudAiClient) {
        return cloudAiClient.agents();
    }

    @Bean
    @ConditionalOnMissingBean
    public IConversationService conversationService(CloudAiClient cloudAiClient) {
        return cloudAiClient.conversations();
    }

    @Bean
    @ConditionalOnMissingBean
    public IResponseService responseService(CloudAiClient cloudAiClient) {
        return cloudAiClient.responses();
    }

    private static Duration timeout(TwcaiProperties properties) {
        return properties.getTimeout() == null ? CloudAiClient.DEFAULT_TIMEOUT : properties.getTimeout();
    }

    public static CloseableHttpClient pooledHttpClient(int maxTotal, int maxPerRoute, Duration timeout) {
        PoolingHttpClientConnectionManager connectionManager =
            new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxTotal);
        connectionManager.setDefaultMaxPerRoute(maxPerRoute);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .setSocketTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .build());

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .setResponseTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .build();

        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    }
}
