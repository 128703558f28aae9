package org.twcai.domain.exception;

import lombok.Getter;

/**
 * Unchecked failure raised by every client operation.
 *
 * <p>{@link #getKind()} identifies the failure; the message is informational and is either the
 * server-provided body text or the default message of the kind.</p>
 */
@Getter
public class CloudAiException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * HTTP status of the failed call, {@code null} when no status was received.
     */
    private final Integer status;

    public CloudAiException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public CloudAiException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public CloudAiException(ErrorKind kind, Integer status, String message, Throwable cause) {
        super(message == null ? kind.getDefaultMessage() : message, cause);
        this.kind = kind;
        this.status = status;
    }

    /**
     * Maps a non-2xx HTTP status to its error kind.
     * 401, 403 and 404 are matched first, then the 5xx range; every other status is an invalid request.
     *
     * @param status HTTP status code
     * @param body   response body text, may be {@code null}
     */
    public static CloudAiException fromStatus(int status, String body) {
        ErrorKind kind;
        if (status == 401) {
            kind = ErrorKind.UNAUTHORIZED;
        } else if (status == 403) {
            kind = ErrorKind.FORBIDDEN;
        } else if (status == 404) {
            kind = ErrorKind.NOT_FOUND;
        } else if (status >= 500 && status <= 599) {
            kind = ErrorKind.SERVER_ERROR;
        } else {
            kind = ErrorKind.INVALID_REQUEST;
        }
        String message = body == null || body.isBlank() ? kind.getDefaultMessage() : body;
        return new CloudAiException(kind, status, message, null);
    }

    public static CloudAiException transport(String message, Throwable cause) {
        return new CloudAiException(ErrorKind.TRANSPORT_FAILURE, message, cause);
    }

    public static CloudAiException decode(String message, Throwable cause) {
        return new CloudAiException(ErrorKind.DECODE_FAILURE, message, cause);
    }

    public static CloudAiException configuration(String message) {
        return new CloudAiException(ErrorKind.CONFIGURATION_ERROR, message);
    }

    public static CloudAiException invalidRequest(String message) {
        return new CloudAiException(ErrorKind.INVALID_REQUEST, message);
    }

    public static CloudAiException cancelled(String responseId) {
        return new CloudAiException(ErrorKind.CANCELLED, "Response " + responseId + " was cancelled");
    }
}
