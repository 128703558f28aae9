package org.twcai.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.hc.core5.http.Method;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.twcai.CloudAiClient;
import org.twcai.domain.exception.CloudAiException;
import org.twcai.domain.exception.ErrorKind;
import org.twcai.domain.vo.Conversation;
import org.twcai.support.RecordedRequest;
import org.twcai.support.StubCloudAiServer;
import org.twcai.support.StubResponse;
import org.twcai.utils.JsonUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestDispatcherTest {

    private StubCloudAiServer server;
    private CloudAiClient client;
    private RequestDispatcher dispatcher;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubCloudAiServer();
        client = CloudAiClient.builder()
                .baseUrl(server.baseUrl())
                .token("secret-token")
                .timeout(Duration.ofSeconds(5))
                .build();
        dispatcher = new RequestDispatcher(client.getConfig(), JsonUtils.createObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        dispatcher.close();
        client.close();
        server.close();
    }

    @Test
    void authenticatedRequestCarriesBearerAndClientHeaders() {
        server.respond("GET", "/ping", 200, "{\"id\":\"conv_1\",\"object\":\"conversation\"}");

        Conversation conversation = dispatcher.send(Method.GET, "/ping", true, null, null, Conversation.class);

        assertThat(conversation.getId()).isEqualTo("conv_1");
        RecordedRequest request = server.lastRequest();
        assertThat(request.header("Authorization")).isEqualTo("Bearer secret-token");
        assertThat(request.header("x-proxy-source")).isEqualTo("twcai-java");
        assertThat(request.header("X-Request-Id")).isNotBlank();
        assertThat(request.header("Accept")).isEqualTo("application/json");
    }

    @Test
    void eachRequestGetsItsOwnRequestId() {
        server.respond("GET", "/ping", 200, "{}");

        dispatcher.send(Method.GET, "/ping", true, null, null, JsonNode.class);
        dispatcher.send(Method.GET, "/ping", true, null, null, JsonNode.class);

        assertThat(server.requests()).hasSize(2);
        assertThat(server.requests().get(0).header("X-Request-Id"))
                .isNotEqualTo(server.requests().get(1).header("X-Request-Id"));
    }

    @Test
    void unauthenticatedRequestOmitsAuthorization() {
        server.respond("GET", "/open", request -> new StubResponse(200, "window.x = 1;", "application/javascript"));

        String text = dispatcher.sendForText(Method.GET, "/open", false, null, Map.of());

        assertThat(text).isEqualTo("window.x = 1;");
        assertThat(server.lastRequest().header("Authorization")).isNull();
        assertThat(server.lastRequest().header("Accept")).isEqualTo("*/*");
    }

    @Test
    void textRequestMayNarrowAccept() {
        server.respond("GET", "/open", request -> new StubResponse(200, "x", "text/javascript"));

        dispatcher.sendForText(Method.GET, "/open", false, null, Map.of("Accept", "text/javascript"));

        assertThat(server.lastRequest().header("Accept")).isEqualTo("text/javascript");
    }

    @Test
    void jsonBodyIsSentWithContentType() {
        server.respond("POST", "/echo", 200, "{}");

        dispatcher.send(Method.POST, "/echo", true, Map.of("metadata", Map.of("topic", "demo")), null, JsonNode.class);

        RecordedRequest request = server.lastRequest();
        assertThat(request.header("Content-Type")).startsWith("application/json");
        assertThat(request.getBody()).isEqualTo("{\"metadata\":{\"topic\":\"demo\"}}");
    }

    @Test
    void requestWithoutBodySendsNoContentType() {
        server.respond("GET", "/ping", 200, "{}");

        dispatcher.send(Method.GET, "/ping", true, null, null, JsonNode.class);

        assertThat(server.lastRequest().header("Content-Type")).isNull();
        assertThat(server.lastRequest().getBody()).isEmpty();
    }

    @Test
    void queryReachesTheServer() {
        server.respond("GET", "/items", 200, "{}");

        dispatcher.send(Method.GET, "/items", true, null, Map.of("limit", 10), JsonNode.class);

        assertThat(server.lastRequest().getQuery()).isEqualTo("limit=10");
    }

    @Test
    void invalidJsonIsDecodeFailure() {
        server.respond("GET", "/broken", 200, "{not json");

        assertThatThrownBy(() -> dispatcher.send(Method.GET, "/broken", true, null, null, Conversation.class))
                .isInstanceOf(CloudAiException.class)
                .extracting(e -> ((CloudAiException) e).getKind())
                .isEqualTo(ErrorKind.DECODE_FAILURE);
    }

    @Test
    void emptySuccessBodyIsDecodeFailure() {
        server.respond("GET", "/empty", request -> new StubResponse(200, "", "application/json"));

        assertThatThrownBy(() -> dispatcher.send(Method.GET, "/empty", true, null, null, Conversation.class))
                .isInstanceOf(CloudAiException.class)
                .extracting(e -> ((CloudAiException) e).getKind())
                .isEqualTo(ErrorKind.DECODE_FAILURE);
    }

    @Test
    void errorStatusCarriesServerMessage() {
        server.respond("GET", "/fail", request -> new StubResponse(500, "boom", "text/plain"));

        assertThatThrownBy(() -> dispatcher.send(Method.GET, "/fail", true, null, null, Conversation.class))
                .isInstanceOfSatisfying(CloudAiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.SERVER_ERROR);
                    assertThat(e.getStatus()).isEqualTo(500);
                    assertThat(e.getMessage()).isEqualTo("boom");
                });
    }

    @Test
    void forbiddenWithoutBodyUsesDefaultMessage() {
        server.respond("GET", "/forbidden", request -> new StubResponse(403, null, null));

        assertThatThrownBy(() -> dispatcher.send(Method.GET, "/forbidden", true, null, null, Conversation.class))
                .isInstanceOfSatisfying(CloudAiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
                    assertThat(e.getMessage()).isEqualTo(ErrorKind.FORBIDDEN.getDefaultMessage());
                });
    }

    @Test
    void errorStatusOnTextEndpoint() {
        server.respond("GET", "/script", request -> new StubResponse(401, "bad token", "text/plain"));

        assertThatThrownBy(() -> dispatcher.sendForText(Method.GET, "/script", false, null, Map.of()))
                .isInstanceOfSatisfying(CloudAiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNAUTHORIZED));
    }

    @Test
    void noContentSucceedsOn204() {
        server.respond("DELETE", "/thing", request -> new StubResponse(204, null, null));

        dispatcher.sendForNoContent(Method.DELETE, "/thing", true);

        assertThat(server.lastRequest().getMethod()).isEqualTo("DELETE");
    }

    @Test
    void slowBodyIsCutOffAtTheTimeout() throws IOException {
        server.respond("GET", "/slow", request -> new StubResponse(200, "{\"a\":\"0123456789012345678901234567\"}",
                "application/json", Duration.ofMillis(100)));
        try (CloudAiClient shortClient = CloudAiClient.builder()
                .baseUrl(server.baseUrl())
                .token("secret-token")
                .timeout(Duration.ofSeconds(1))
                .build();
             RequestDispatcher shortDispatcher = new RequestDispatcher(shortClient.getConfig(),
                     JsonUtils.createObjectMapper())) {
            long started = System.nanoTime();

            assertThatThrownBy(() -> shortDispatcher.send(Method.GET, "/slow", true, null, null, JsonNode.class))
                    .isInstanceOfSatisfying(CloudAiException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSPORT_FAILURE);
                        assertThat(e.getMessage()).contains("timed out");
                    });

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(900));
            assertThat(elapsed).isLessThan(Duration.ofMillis(2500));
        }
    }

    @Test
    void responseWithinTheTimeoutIsNotCancelled() throws IOException {
        server.respond("GET", "/steady", request -> new StubResponse(200, "{\"a\":1}", "application/json",
                Duration.ofMillis(20)));
        try (CloudAiClient shortClient = CloudAiClient.builder()
                .baseUrl(server.baseUrl())
                .token("secret-token")
                .timeout(Duration.ofSeconds(2))
                .build();
             RequestDispatcher shortDispatcher = new RequestDispatcher(shortClient.getConfig(),
                     JsonUtils.createObjectMapper())) {
            JsonNode node = shortDispatcher.send(Method.GET, "/steady", true, null, null, JsonNode.class);

            assertThat(node.get("a").asInt()).isEqualTo(1);
        }
    }

    @Test
    void closedDispatcherRejectsCalls() {
        dispatcher.close();

        assertThatThrownBy(() -> dispatcher.send(Method.GET, "/ping", true, null, null, JsonNode.class))
                .isInstanceOfSatisfying(CloudAiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONFIGURATION_ERROR));
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void unreachableServerIsTransportFailure() throws IOException {
        String deadBaseUrl;
        try (StubCloudAiServer closed = new StubCloudAiServer()) {
            deadBaseUrl = closed.baseUrl();
        }
        try (CloudAiClient deadClient = CloudAiClient.builder()
                .baseUrl(deadBaseUrl)
                .token("secret-token")
                .timeout(Duration.ofSeconds(2))
                .build()) {
            RequestDispatcher deadDispatcher = new RequestDispatcher(deadClient.getConfig(),
                    JsonUtils.createObjectMapper());

            assertThatThrownBy(() -> deadDispatcher.send(Method.GET, "/ping", true, null, null, JsonNode.class))
                    .isInstanceOfSatisfying(CloudAiException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSPORT_FAILURE);
                        assertThat(e.getStatus()).isNull();
                    });
        }
    }
}
