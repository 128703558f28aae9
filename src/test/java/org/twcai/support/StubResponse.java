package org.twcai.support;

import lombok.Getter;

import java.time.Duration;

@Getter
public class StubResponse {

    private final int status;
    private final String body;
    private final String contentType;

    /**
     * Pause before each body byte, {@code null} to write the body at once.
     */
    private final Duration byteDelay;

    public StubResponse(int status, String body, String contentType) {
        this(status, body, contentType, null);
    }

    public StubResponse(int status, String body, String contentType, Duration byteDelay) {
        this.status = status;
        this.body = body;
        this.contentType = contentType;
        this.byteDelay = byteDelay;
    }

    public static StubResponse json(String body) {
        return new StubResponse(200, body, "application/json");
    }
}
