package org.twcai.domain.exception;

import lombok.Getter;

/**
 * Closed set of failure kinds a caller can branch on.
 */
@Getter
public enum ErrorKind {

    TRANSPORT_FAILURE("HTTP request failed"),

    DECODE_FAILURE("Response payload could not be decoded"),

    UNAUTHORIZED("Authentication failed - invalid or expired token"),

    FORBIDDEN("Access forbidden - domain not whitelisted or agent suspended"),

    NOT_FOUND("Resource not found"),

    INVALID_REQUEST("Bad request"),

    SERVER_ERROR("Internal server error"),

    CONFIGURATION_ERROR("Client configuration error"),

    CANCELLED("Response was cancelled");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }
}
