package org.twcai;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.twcai.config.ClientConfig;
import org.twcai.config.HttpClientConfig;
import org.twcai.domain.exception.CloudAiException;
import org.twcai.http.RequestDispatcher;
import org.twcai.service.IAgentService;
import org.twcai.service.IConversationService;
import org.twcai.service.IResponseService;
import org.twcai.service.impl.AgentServiceImpl;
import org.twcai.service.impl.ConversationServiceImpl;
import org.twcai.service.impl.ResponseServiceImpl;
import org.twcai.utils.JsonUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.function.Function;

/**
 * Entry point of the Timeweb Cloud AI client.
 *
 * <pre>{@code
 * CloudAiClient client = CloudAiClient.builder()
 *         .token(System.getenv("TWCAI_API_TOKEN"))
 *         .build();
 * ChatCompletionResponse reply = client.agents().chatCompletions(agentId, request);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe. Closing the client stops its request deadlines and releases the
 * transport only when the client created it; a closed client rejects further calls.</p>
 */
@Slf4j
public class CloudAiClient implements Closeable {

    public static final String DEFAULT_BASE_URL = "https://agent.timeweb.cloud";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public static final String ENV_BASE_URL = "TWCAI_BASE_URL";
    public static final String ENV_API_TOKEN = "TWCAI_API_TOKEN";

    private static final int DEFAULT_MAX_CONNECTIONS = 200;
    private static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 50;

    private final ClientConfig config;
    private final boolean ownsHttpClient;
    private final RequestDispatcher dispatcher;
    private final IAgentService agents;
    private final IConversationService conversations;
    private final IResponseService responses;

    private CloudAiClient(ClientConfig config, boolean ownsHttpClient) {
        this.config = config;
        this.ownsHttpClient = ownsHttpClient;
        this.dispatcher = new RequestDispatcher(config, JsonUtils.createObjectMapper());
        this.agents = new AgentServiceImpl(dispatcher);
        this.conversations = new ConversationServiceImpl(dispatcher);
        this.responses = new ResponseServiceImpl(dispatcher);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a client from {@code TWCAI_BASE_URL} (optional) and {@code TWCAI_API_TOKEN} (required).
     */
    public static CloudAiClient fromEnv() {
        return fromEnv(System::getenv);
    }

    static CloudAiClient fromEnv(Function<String, String> environment) {
        String token = environment.apply(ENV_API_TOKEN);
        if (token == null) {
            throw CloudAiException.configuration(ENV_API_TOKEN + " environment variable not set");
        }
        String baseUrl = environment.apply(ENV_BASE_URL);
        return builder()
                .baseUrl(baseUrl == null ? DEFAULT_BASE_URL : baseUrl)
                .token(token)
                .build();
    }

    public IAgentService agents() {
        return agents;
    }

    public IConversationService conversations() {
        return conversations;
    }

    public IResponseService responses() {
        return responses;
    }

    public ClientConfig getConfig() {
        return config;
    }

    @Override
    public void close() throws IOException {
        dispatcher.close();
        if (ownsHttpClient) {
            config.getHttpClient().close();
        }
    }

    public static class Builder {

        private String baseUrl = DEFAULT_BASE_URL;
        private String token;
        private Duration timeout = DEFAULT_TIMEOUT;
        private CloseableHttpClient httpClient;

        Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Total duration allowed for each call.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Shares an existing transport. The client will not close it.
         */
        public Builder httpClient(CloseableHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * @throws CloudAiException of kind {@code CONFIGURATION_ERROR} when the base URL or token is missing,
         *                          or the base URL or timeout is invalid
         */
        public CloudAiClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw CloudAiException.configuration("Base URL is required");
            }
            if (token == null || token.isBlank()) {
                throw CloudAiException.configuration("Token is required");
            }
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw CloudAiException.configuration("Timeout must be positive");
            }
            String normalizedBaseUrl = normalizeBaseUrl(baseUrl);

            boolean ownsHttpClient = httpClient == null;
            CloseableHttpClient transport = ownsHttpClient
                    ? HttpClientConfig.pooledHttpClient(DEFAULT_MAX_CONNECTIONS, DEFAULT_MAX_CONNECTIONS_PER_ROUTE,
                    timeout)
                    : httpClient;
            log.debug("Cloud AI client configured for {}", normalizedBaseUrl);
            return new CloudAiClient(new ClientConfig(normalizedBaseUrl, token, timeout, transport), ownsHttpClient);
        }

        private static String normalizeBaseUrl(String baseUrl) {
            String trimmed = baseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            try {
                URI uri = URI.create(trimmed);
                if (uri.getScheme() == null || uri.getHost() == null) {
                    throw CloudAiException.configuration("Base URL must be absolute: " + baseUrl);
                }
            } catch (IllegalArgumentException e) {
                throw CloudAiException.configuration("Invalid base URL: " + baseUrl);
            }
            return trimmed;
        }
    }
}
