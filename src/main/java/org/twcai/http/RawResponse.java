package org.twcai.http;

import lombok.Getter;

/**
 * Status and body of a completed exchange. Success bodies are kept as bytes for decoding; failure bodies are
 * read as text for the error message.
 */
@Getter
final class RawResponse {

    private final int status;

    private final byte[] body;

    private final String errorText;

    RawResponse(int status, byte[] body, String errorText) {
        this.status = status;
        this.body = body;
        this.errorText = errorText;
    }

    boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
