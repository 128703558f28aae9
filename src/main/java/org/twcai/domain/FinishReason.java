package org.twcai.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the model stopped generating. Values the client does not know decode to {@code null}.
 */
public enum FinishReason {

    STOP("stop"),
    LENGTH("length"),
    CONTENT_FILTER("content_filter"),
    TOOL_CALLS("tool_calls");

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
