package org.twcai.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.twcai.config.ClientConfig;
import org.twcai.domain.exception.CloudAiException;
import org.twcai.utils.UrlUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Shared build/send/decode pipeline behind every endpoint group.
 *
 * <p>Each call is a single blocking exchange on the shared transport, bounded by the configured timeout from
 * connect to the last body byte. When the deadline passes the request is cancelled. Failures are never retried:
 * a send failure or an expired deadline raises {@code TRANSPORT_FAILURE}, an undecodable 2xx body raises
 * {@code DECODE_FAILURE} and any other status is classified by {@link CloudAiException#fromStatus(int, String)}.</p>
 */
@Slf4j
public class RequestDispatcher implements Closeable {

    public static final String CLIENT_SOURCE_HEADER = "x-proxy-source";
    public static final String CLIENT_SOURCE = "twcai-java";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String JSON = ContentType.APPLICATION_JSON.getMimeType();
    private static final String ACCEPT_ANY = "*/*";

    private final ClientConfig config;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService deadlines;

    public RequestDispatcher(ClientConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "twcai-request-deadline");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Sends a request and decodes a JSON success body into {@code responseType}.
     *
     * @param auth  attach the bearer credential
     * @param body  JSON request body, {@code null} for none
     * @param query query object or map, {@code null} for none
     */
    public <T> T send(Method method, String path, boolean auth, Object body, Object query, Class<T> responseType) {
        HttpUriRequestBase request = buildRequest(method, path, auth, JSON, body, query, Map.of());
        RawResponse response = execute(request);
        if (!response.isSuccess()) {
            throw classify(request, response);
        }
        try {
            return objectMapper.readValue(response.getBody(), responseType);
        } catch (IOException e) {
            log.warn("Failed to decode {} {} as {}", request.getMethod(), request.getRequestUri(),
                    responseType.getSimpleName(), e);
            throw CloudAiException.decode("Failed to decode " + responseType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Sends a request and returns the success body as plain text, without JSON decoding. Any media type is
     * accepted unless {@code headers} sets {@code Accept}.
     */
    public String sendForText(Method method, String path, boolean auth, Object query, Map<String, String> headers) {
        HttpUriRequestBase request = buildRequest(method, path, auth, ACCEPT_ANY, null, query, headers);
        RawResponse response = execute(request);
        if (!response.isSuccess()) {
            throw classify(request, response);
        }
        return new String(response.getBody(), StandardCharsets.UTF_8);
    }

    /**
     * Sends a request whose success carries no payload; any 2xx, 204 included, completes normally.
     */
    public void sendForNoContent(Method method, String path, boolean auth) {
        HttpUriRequestBase request = buildRequest(method, path, auth, JSON, null, null, Map.of());
        RawResponse response = execute(request);
        if (!response.isSuccess()) {
            throw classify(request, response);
        }
    }

    @Override
    public void close() {
        deadlines.shutdownNow();
    }

    URI buildUri(String path, Object query) {
        List<NameValuePair> parameters = UrlUtils.toQueryParameters(objectMapper, query);
        try {
            URIBuilder builder = new URIBuilder(config.getBaseUrl() + path);
            if (!parameters.isEmpty()) {
                builder.addParameters(parameters);
            }
            return builder.build();
        } catch (URISyntaxException e) {
            throw CloudAiException.invalidRequest("Invalid request URL: " + e.getMessage());
        }
    }

    private HttpUriRequestBase buildRequest(Method method, String path, boolean auth, String accept, Object body,
                                            Object query, Map<String, String> headers) {
        HttpUriRequestBase request = new HttpUriRequestBase(method.name(), buildUri(path, query));
        long timeoutMillis = config.getTimeout().toMillis();
        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .setResponseTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build());

        request.setHeader(HttpHeaders.ACCEPT, accept);
        request.setHeader(CLIENT_SOURCE_HEADER, CLIENT_SOURCE);
        request.setHeader(REQUEST_ID_HEADER, UUID.randomUUID().toString());
        if (auth) {
            request.setHeader(HttpHeaders.AUTHORIZATION, config.authorizationHeader());
        }
        headers.forEach(request::setHeader);

        if (body != null) {
            try {
                request.setEntity(new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
            } catch (JsonProcessingException e) {
                throw CloudAiException.decode("Failed to encode " + body.getClass().getSimpleName() + ": "
                        + e.getOriginalMessage(), e);
            }
        }
        return request;
    }

    private RawResponse execute(HttpUriRequestBase request) {
        String requestId = request.getFirstHeader(REQUEST_ID_HEADER).getValue();
        log.debug("Sending {} {} [request: {}]", request.getMethod(), request.getRequestUri(), requestId);
        long timeoutMillis = config.getTimeout().toMillis();
        ScheduledFuture<?> deadline;
        try {
            deadline = deadlines.schedule(request::cancel, timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw CloudAiException.configuration("Client is closed");
        }
        try {
            RawResponse response = config.getHttpClient().execute(request, httpResponse -> {
                int status = httpResponse.getCode();
                HttpEntity entity = httpResponse.getEntity();
                if (status >= 200 && status < 300) {
                    byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
                    return new RawResponse(status, body, null);
                }
                return new RawResponse(status, null, readErrorText(entity));
            });
            log.debug("Received status {} for {} {} [request: {}]", response.getStatus(), request.getMethod(),
                    request.getRequestUri(), requestId);
            return response;
        } catch (IOException e) {
            if (request.isCancelled()) {
                log.error("Request {} {} exceeded {} ms [request: {}]", request.getMethod(), request.getRequestUri(),
                        timeoutMillis, requestId);
                throw CloudAiException.transport("HTTP request timed out after " + timeoutMillis + " ms", e);
            }
            log.error("Request {} {} failed [request: {}]", request.getMethod(), request.getRequestUri(), requestId, e);
            throw CloudAiException.transport("HTTP request failed: " + e.getMessage(), e);
        } finally {
            deadline.cancel(false);
        }
    }

    private CloudAiException classify(HttpUriRequestBase request, RawResponse response) {
        CloudAiException exception = CloudAiException.fromStatus(response.getStatus(), response.getErrorText());
        log.warn("{} {} returned status {} ({})", request.getMethod(), request.getRequestUri(),
                response.getStatus(), exception.getKind());
        return exception;
    }

    private static String readErrorText(HttpEntity entity) {
        if (entity == null) {
            return null;
        }
        try {
            return EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (IOException | ParseException e) {
            // the status alone still classifies the failure
            log.debug("Could not read error body", e);
            return null;
        }
    }
}
